package de.bsommerfeld.moltgraph.moltbook;

import java.time.Duration;

/**
 * Outcome of {@link RetryPolicy}: either pause and try again, or stop.
 */
public sealed interface RetryDecision permits RetryDecision.Wait, RetryDecision.GiveUp {

    record Wait(Duration delay, String reason) implements RetryDecision {
    }

    record GiveUp(String reason) implements RetryDecision {
    }
}
