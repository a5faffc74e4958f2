package de.bsommerfeld.moltgraph.moltbook;

import de.bsommerfeld.moltgraph.core.config.ApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a failed exchange is retried and how long to wait first.
 * Pure apart from reading the clock for absolute reset headers; the loop that
 * acts on the decision lives in {@link HttpTransport}.
 *
 * <h3>Status handling</h3>
 * <ul>
 * <li>{@code 429}: {@code Retry-After} (delta seconds or HTTP date), else
 * {@code X-RateLimit-Reset} (absolute epoch seconds or milliseconds), else a
 * fixed cooldown. Never less than one second.</li>
 * <li>{@code 502}, {@code 503}, {@code 504}: exponential backoff
 * {@code seed * 2^attempt}, capped at the ceiling.</li>
 * <li>Anything else: give up.</li>
 * </ul>
 * Network failures use the same backoff as 5xx. Every retry, including 429,
 * consumes one attempt.
 */
public class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);

    private static final Duration MIN_RATE_LIMIT_WAIT = Duration.ofSeconds(1);

    /** Reset values at or above this are epoch milliseconds, below it seconds. */
    private static final double EPOCH_MILLIS_THRESHOLD = 1e12;

    private final int maxAttempts;
    private final Duration seed;
    private final Duration ceiling;
    private final Duration cooldown;
    private final Clock clock;

    public RetryPolicy(ApiConfig config, Clock clock) {
        this(config.getMaxRetries(), config.getBackoffSeed(), config.getBackoffCeiling(),
                config.getRateLimitCooldown(), clock);
    }

    RetryPolicy(int maxAttempts, Duration seed, Duration ceiling, Duration cooldown, Clock clock) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.seed = seed;
        this.ceiling = ceiling;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * @param status  HTTP status of the failed exchange
     * @param headers its response headers
     * @param attempt zero-based index of the attempt that just failed
     */
    public RetryDecision decide(int status, HttpHeaders headers, int attempt) {
        if (!RETRYABLE_STATUSES.contains(status)) {
            return new RetryDecision.GiveUp("HTTP " + status + " is not retryable");
        }
        if (attempt + 1 >= maxAttempts) {
            return new RetryDecision.GiveUp("HTTP " + status + " after " + maxAttempts + " attempts");
        }
        if (status == 429) {
            return new RetryDecision.Wait(rateLimitWait(headers), "rate limited");
        }
        return new RetryDecision.Wait(backoff(attempt), "HTTP " + status);
    }

    /**
     * Decision after an I/O failure or timeout.
     */
    public RetryDecision decideOnError(int attempt) {
        if (attempt + 1 >= maxAttempts) {
            return new RetryDecision.GiveUp("network failure after " + maxAttempts + " attempts");
        }
        return new RetryDecision.Wait(backoff(attempt), "network failure");
    }

    Duration backoff(int attempt) {
        long seedMillis = seed.toMillis();
        long ceilingMillis = ceiling.toMillis();
        int shift = Math.min(attempt, 30);
        if (seedMillis > (ceilingMillis >> shift)) {
            return ceiling;
        }
        return Duration.ofMillis(Math.min(seedMillis << shift, ceilingMillis));
    }

    Duration rateLimitWait(HttpHeaders headers) {
        Optional<Duration> wait = headers.firstValue("Retry-After").flatMap(this::parseRetryAfter);
        if (wait.isEmpty()) {
            wait = headers.firstValue("X-RateLimit-Reset").flatMap(this::parseReset);
        }
        Duration delay = wait.orElse(cooldown);
        return delay.compareTo(MIN_RATE_LIMIT_WAIT) < 0 ? MIN_RATE_LIMIT_WAIT : delay;
    }

    private Optional<Duration> parseRetryAfter(String value) {
        String trimmed = value.trim();
        if (trimmed.matches("\\d+")) {
            return Optional.of(Duration.ofSeconds(Long.parseLong(trimmed)));
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            return Optional.of(Duration.between(clock.instant(), at.toInstant()));
        } catch (DateTimeParseException e) {
            LOG.debug("Unparseable Retry-After header '{}'", value);
            return Optional.empty();
        }
    }

    private Optional<Duration> parseReset(String value) {
        double reset;
        try {
            reset = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable X-RateLimit-Reset header '{}'", value);
            return Optional.empty();
        }
        long resetMillis = reset >= EPOCH_MILLIS_THRESHOLD ? (long) reset : (long) (reset * 1000);
        return Optional.of(Duration.ofMillis(resetMillis - clock.millis()));
    }
}
