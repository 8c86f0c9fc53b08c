package io.stagewise.core.execution;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/// Per-node retry configuration: exponential backoff with bounded attempts and jitter.
///
/// The delay before attempt `n + 1` is `min(initial * factor^(n-1), max)`, plus a uniform
/// random offset in `[0, 1s)` when jitter is enabled.
///
/// @param initialInterval delay after the first failure, not null
/// @param backoffFactor multiplier applied per further failure, at least 1
/// @param maxInterval upper bound for the un-jittered delay, not null
/// @param maxAttempts total invocations including the first, at least 1
/// @param jitter whether to add a random offset to every delay
/// @param classifier decides which failures are retried, not null
public record RetryPolicy(
        Duration initialInterval,
        double backoffFactor,
        Duration maxInterval,
        int maxAttempts,
        boolean jitter,
        RetryClassifier classifier) {

    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(500);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(128);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final RetryPolicy DEFAULTS =
            new RetryPolicy(
                    DEFAULT_INITIAL_INTERVAL,
                    DEFAULT_BACKOFF_FACTOR,
                    DEFAULT_MAX_INTERVAL,
                    DEFAULT_MAX_ATTEMPTS,
                    true,
                    new DefaultRetryClassifier());

    private static final RetryPolicy NO_RETRY =
            new RetryPolicy(Duration.ZERO, 1.0, Duration.ZERO, 1, false, error -> false);

    public RetryPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval must not be null");
        Objects.requireNonNull(maxInterval, "maxInterval must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1, got " + backoffFactor);
        }
    }

    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /// Policy for non-idempotent nodes: a single attempt, never retried.
    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(initialInterval, backoffFactor, maxInterval, attempts, jitter, classifier);
    }

    public RetryPolicy withJitter(boolean enabled) {
        return new RetryPolicy(initialInterval, backoffFactor, maxInterval, maxAttempts, enabled, classifier);
    }

    /// Returns the un-jittered delay following a failed attempt.
    ///
    /// @param failedAttempt the 1-based attempt that just failed
    /// @return the base delay, never null
    public Duration baseDelay(int failedAttempt) {
        double millis = initialInterval.toMillis() * Math.pow(backoffFactor, failedAttempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxInterval.toMillis()));
    }

    /// Returns the delay to wait after a failed attempt, jitter included.
    ///
    /// @param failedAttempt the 1-based attempt that just failed
    /// @return the delay, never null
    public Duration delayForAttempt(int failedAttempt) {
        Duration base = baseDelay(failedAttempt);
        if (!jitter) {
            return base;
        }
        return base.plusMillis(ThreadLocalRandom.current().nextLong(1000));
    }
}
