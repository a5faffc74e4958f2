package de.bsommerfeld.moltgraph.moltbook;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));
        sleeps = new ArrayList<>();
        // 80 rpm -> 750 ms spacing; sleeping advances the clock
        limiter = new RateLimiter(80, clock, d -> {
            sleeps.add(d);
            clock.advance(d);
        });
    }

    @Test
    void acquire_shouldNotWaitOnFirstCall() throws Exception {
        limiter.acquire();
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void acquire_shouldWaitRemainderOfInterval() throws Exception {
        limiter.acquire();
        clock.advance(Duration.ofMillis(200));
        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(550)), sleeps);
    }

    @Test
    void acquire_shouldNotWaitWhenIntervalAlreadyPassed() throws Exception {
        limiter.acquire();
        clock.advance(Duration.ofSeconds(2));
        limiter.acquire();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void acquire_shouldSpaceBackToBackCalls() throws Exception {
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(750), Duration.ofMillis(750)), sleeps);
    }

    @Test
    void minInterval_shouldDeriveFromBudget() {
        assertEquals(Duration.ofMillis(750), limiter.minInterval());
        assertEquals(Duration.ofSeconds(1), new RateLimiter(60, clock, d -> {
        }).minInterval());
    }

    @Test
    void constructor_shouldRejectNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, clock, d -> {
        }));
    }
}
