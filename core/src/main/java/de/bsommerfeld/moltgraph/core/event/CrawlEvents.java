package de.bsommerfeld.moltgraph.core.event;

import de.bsommerfeld.moltgraph.core.domain.CrawlMode;

import java.time.Duration;
import java.time.Instant;

/**
 * Crawl lifecycle events posted on the {@link CrawlEventBus}.
 */
public final class CrawlEvents {

    private CrawlEvents() {
    }

    /**
     * @param cutoff  lower time bound of an incremental run, {@code null} when
     *                unbounded
     * @param resumed whether an unfinished crawl record was picked up
     */
    public record CrawlStarted(String crawlId, CrawlMode mode, Instant cutoff, boolean resumed) {
    }

    /**
     * @param records entities the stage contributed (posts, agents, ...)
     */
    public record StageFinished(String crawlId, String stage, int records, Duration elapsed) {
    }

    public record StageFailed(String crawlId, String stage, String error) {
    }

    public record CrawlFinished(String crawlId, int stagesFailed, Duration elapsed) {
    }
}
