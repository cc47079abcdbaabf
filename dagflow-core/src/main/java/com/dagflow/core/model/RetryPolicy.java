package com.dagflow.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for retry behavior.
 * Immutable and reusable across task specs.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 * - retryableErrors and nonRetryableErrors are disjoint
 *
 * Successive backoffs are non-decreasing whenever backoffMultiplier >= 1 + jitterFactor.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default retry policy: 3 attempts, exponential backoff starting at 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            3,
            Duration.ofSeconds(1),
            Duration.ofMinutes(5),
            2.0,
            0.1,
            Set.of(),
            Set.of()
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(
            1,
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0,
            Set.of(),
            Set.of()
        );
    }

    /**
     * Compute the backoff to wait after the given attempt failed.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return Duration to wait before the next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // Base backoff: initialBackoff * (multiplier ^ (attempt - 1))
        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, attemptNumber - 1);

        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // Jitter only stretches the delay, and never past the cap
        double jitteredBackoffMs = cappedBackoffMs +
            ThreadLocalRandom.current().nextDouble() * cappedBackoffMs * jitterFactor;

        return Duration.ofMillis((long) Math.min(jitteredBackoffMs, maxBackoff.toMillis()));
    }

    /**
     * Check if the given error code should trigger a retry.
     *
     * @param errorCode The error code from the failed attempt
     * @return true if retry should be attempted
     */
    public boolean shouldRetry(String errorCode) {
        if (!nonRetryableErrors.isEmpty() && nonRetryableErrors.contains(errorCode)) {
            return false;
        }

        // If retryable list is empty, retry everything not in non-retryable
        if (retryableErrors.isEmpty()) {
            return true;
        }

        return retryableErrors.contains(errorCode);
    }

    /**
     * Check if more attempts are available.
     *
     * @param currentAttempt Current attempt number (1-indexed)
     * @return true if more attempts can be made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    /**
     * Builder for RetryPolicy.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Number of retries after the first attempt.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxAttempts = maxRetries + 1;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryableErrors(Set<String> retryableErrors) {
            this.retryableErrors = retryableErrors;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor,
                retryableErrors, nonRetryableErrors
            );
        }
    }
}
