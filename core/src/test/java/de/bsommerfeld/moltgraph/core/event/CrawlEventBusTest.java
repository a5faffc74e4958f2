package de.bsommerfeld.moltgraph.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CrawlEventBusTest {

    @Test
    void post_shouldDeliverLifecycleEventsToSubscriber() {
        var eventBus = new CrawlEventBus();
        List<Object> received = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onStarted(CrawlEvents.CrawlStarted event) {
                received.add(event);
            }

            @Subscribe
            public void onFinished(CrawlEvents.CrawlFinished event) {
                received.add(event);
            }
        };
        eventBus.register(listener);

        var started = new CrawlEvents.CrawlStarted("full:1", CrawlMode.FULL, null, false);
        var finished = new CrawlEvents.CrawlFinished("full:1", 0, Duration.ofSeconds(3));
        eventBus.post(started);
        eventBus.post(new CrawlEvents.StageFailed("full:1", "me", "boom"));
        eventBus.post(finished);

        assertEquals(List.of(started, finished), received);
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new CrawlEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(CrawlEvents.StageFailed event) {
                received.set(event.stage());
            }
        };

        eventBus.register(listener);
        eventBus.post(new CrawlEvents.StageFailed("c", "first", "x"));
        eventBus.unregister(listener);
        eventBus.post(new CrawlEvents.StageFailed("c", "second", "x"));

        assertEquals("first", received.get());
    }
}
