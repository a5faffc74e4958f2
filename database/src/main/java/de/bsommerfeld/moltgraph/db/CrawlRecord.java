package de.bsommerfeld.moltgraph.db;

import de.bsommerfeld.moltgraph.core.domain.CrawlMode;

import java.time.Instant;

/**
 * Bookkeeping row of one crawl run.
 *
 * @param cutoff        the run's own cutoff (its start time); the next
 *                      incremental run scans back to here
 * @param endedAt       {@code null} while the run is unfinished
 */
public record CrawlRecord(
        String id,
        CrawlMode mode,
        Instant cutoff,
        Instant startedAt,
        Instant endedAt,
        Instant lastUpdatedAt) {
}
