package de.bsommerfeld.moltgraph.moltbook;

import java.time.Clock;
import java.time.Duration;

/**
 * Enforces a minimum spacing between outgoing requests, derived from a
 * requests-per-minute budget.
 *
 * <p>
 * One instance is shared by everything that talks to the API, so the "time
 * of the last request" exists exactly once per process. {@link #acquire()} is
 * synchronized: concurrent callers queue up and each still observes the full
 * interval.
 */
public class RateLimiter {

    private final long minIntervalMillis;
    private final Clock clock;
    private final Sleeper sleeper;

    private long lastRequestMillis;
    private boolean started;

    public RateLimiter(int requestsPerMinute, Clock clock, Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive, got " + requestsPerMinute);
        }
        this.minIntervalMillis = 60_000L / requestsPerMinute;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Waits until the minimum interval since the previous request has passed,
     * then records the current time as the new request time. The first call
     * never waits.
     */
    public synchronized void acquire() throws InterruptedException {
        long now = clock.millis();
        if (started) {
            long wait = lastRequestMillis + minIntervalMillis - now;
            if (wait > 0) {
                sleeper.sleep(Duration.ofMillis(wait));
                now = clock.millis();
            }
        }
        lastRequestMillis = now;
        started = true;
    }

    public Duration minInterval() {
        return Duration.ofMillis(minIntervalMillis);
    }
}
