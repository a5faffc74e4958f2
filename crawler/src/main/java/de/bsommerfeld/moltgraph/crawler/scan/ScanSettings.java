package de.bsommerfeld.moltgraph.crawler.scan;

import de.bsommerfeld.moltgraph.core.config.CrawlConfig;

import java.time.Instant;

/**
 * Stop thresholds of one scan. A threshold of {@code 0} disables that stop.
 *
 * @param pageSize       items requested per page
 * @param maxPages       page cap
 * @param maxStalePages  consecutive pages without unseen ids before stopping
 * @param maxRepeatPages consecutive identical pages before stopping
 * @param signatureSize  leading ids compared between pages
 * @param cutoff         items at or before this are dropped, {@code null} for
 *                       an unbounded scan
 */
public record ScanSettings(
        int pageSize,
        int maxPages,
        int maxStalePages,
        int maxRepeatPages,
        int signatureSize,
        Instant cutoff) {

    public ScanSettings {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, was " + pageSize);
        }
        signatureSize = Math.max(1, signatureSize);
    }

    public static ScanSettings from(CrawlConfig config) {
        return new ScanSettings(config.getPageSize(), config.getMaxPagesPerView(), config.getMaxStalePages(),
                config.getMaxRepeatPages(), config.getSignatureSize(), null);
    }

    public ScanSettings withCutoff(Instant cutoff) {
        return new ScanSettings(pageSize, maxPages, maxStalePages, maxRepeatPages, signatureSize, cutoff);
    }

    public ScanSettings withMaxPages(int maxPages) {
        return new ScanSettings(pageSize, maxPages, maxStalePages, maxRepeatPages, signatureSize, cutoff);
    }
}
