package de.bsommerfeld.moltgraph.crawler;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.event.CrawlEventBus;
import de.bsommerfeld.moltgraph.core.event.CrawlEvents;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Logs crawl lifecycle events and keeps the stage summary for the final
 * line.
 */
@Singleton
public class CrawlProgressLogger {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlProgressLogger.class);

    private final List<String> summary = new ArrayList<>();

    @Inject
    public CrawlProgressLogger(CrawlEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onStarted(CrawlEvents.CrawlStarted event) {
        summary.clear();
        if (event.cutoff() != null) {
            LOG.info(">> {} crawl {} (since {}{})", event.mode().id(), event.crawlId(), event.cutoff(),
                    event.resumed() ? ", resumed" : "");
        } else {
            LOG.info(">> {} crawl {}{}", event.mode().id(), event.crawlId(), event.resumed() ? " (resumed)" : "");
        }
    }

    @Subscribe
    public void onStageFinished(CrawlEvents.StageFinished event) {
        LOG.info("   {} -> {} records in {} ms", event.stage(), event.records(), event.elapsed().toMillis());
        summary.add(event.stage() + "=" + event.records());
    }

    @Subscribe
    public void onStageFailed(CrawlEvents.StageFailed event) {
        LOG.warn("   {} FAILED: {}", event.stage(), event.error());
        summary.add(event.stage() + "=FAILED");
    }

    @Subscribe
    public void onFinished(CrawlEvents.CrawlFinished event) {
        LOG.info("<< {} finished in {} s [{}]", event.crawlId(), event.elapsed().toSeconds(),
                String.join(", ", summary));
        if (event.stagesFailed() > 0) {
            LOG.warn("<< {} stage(s) failed, see log above", event.stagesFailed());
        }
    }

    List<String> summary() {
        return Collections.unmodifiableList(summary);
    }
}
