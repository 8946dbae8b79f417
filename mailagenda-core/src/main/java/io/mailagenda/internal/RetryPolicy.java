package io.mailagenda.internal;

import io.mailagenda.config.MailAgendaProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry budget and exponential backoff with jitter for transient delivery failures.
 *
 * <p>attempt starts from 1 (first failed attempt). With the defaults: 60s, 120s, 240s ... capped
 * at one hour, plus up to 20% jitter (still capped).
 */
public final class RetryPolicy {

    private static final Duration MIN_DELAY = Duration.ofMillis(1);

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final double multiplier;
    private final long maxDelayMillis;
    private final double jitter;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay,
                       double jitter, DoubleSupplier random) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be a positive duration");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMillis = initialDelay.toMillis();
        this.multiplier = multiplier;
        this.maxDelayMillis = maxDelay.toMillis();
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static RetryPolicy from(MailAgendaProperties props) {
        return new RetryPolicy(
                props.getMaxAttempts(),
                props.getInitialRetryDelay(),
                props.getRetryMultiplier(),
                props.getMaxRetryDelay(),
                props.getRetryJitter(),
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Whether a job that has made {@code attemptCount} attempts may be attempted again.
     */
    public boolean hasAttemptsLeft(int attemptCount) {
        return attemptCount < maxAttempts;
    }

    /**
     * Backoff without jitter. Non-decreasing in {@code attempt}, capped at the maximum delay.
     */
    public Duration baseDelay(int attempt) {
        if (attempt <= 1) {
            return Duration.ofMillis(initialDelayMillis);
        }
        double factor = Math.pow(multiplier, Math.min(attempt - 1, 62));
        long candidate = (long) (initialDelayMillis * factor);
        if (candidate < 0L) {
            candidate = Long.MAX_VALUE;
        }
        return Duration.ofMillis(Math.min(candidate, maxDelayMillis));
    }

    /**
     * Backoff with jitter: within {@code [base, base * (1 + jitter)]}, capped at the maximum delay.
     */
    public Duration delay(int attempt) {
        long base = baseDelay(attempt).toMillis();
        long extra = (long) (base * jitter * random.getAsDouble());
        long total = Math.min(base + Math.max(0L, extra), maxDelayMillis);
        return total < MIN_DELAY.toMillis() ? MIN_DELAY : Duration.ofMillis(total);
    }

    /**
     * Next eligible instant after a failed attempt; always strictly after {@code failedAt}.
     */
    public Instant nextAttemptAt(int attempt, Instant failedAt) {
        return failedAt.plus(delay(attempt));
    }
}
