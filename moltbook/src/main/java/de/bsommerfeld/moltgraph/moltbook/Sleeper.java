package de.bsommerfeld.moltgraph.moltbook;

import java.time.Duration;

/**
 * Blocks the calling thread. Injected wherever the transport pauses so tests
 * can record waits instead of sitting through them.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
