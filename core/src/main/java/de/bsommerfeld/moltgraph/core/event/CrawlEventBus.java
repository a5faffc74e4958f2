package de.bsommerfeld.moltgraph.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that carries crawl lifecycle
 * events from the orchestrator to whoever listens (progress logging today).
 */
@Singleton
public class CrawlEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlEventBus.class);
    private final EventBus eventBus;

    public CrawlEventBus() {
        this.eventBus = new EventBus("MoltGraph-EventBus");
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
