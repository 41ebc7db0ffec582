package com.taskgraph.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry behavior of a task: how many attempts, how long to wait between them,
 * and which error codes are worth another attempt.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxDelay >= initialDelay
 * - multiplier >= 1.0
 * - jitter in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    double multiplier,
    double jitter,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        initialDelay = initialDelay != null ? initialDelay : Duration.ZERO;
        maxDelay = maxDelay != null ? maxDelay : initialDelay;
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be in [0.0, 1.0]");
        }
        retryableErrors = retryableErrors != null ? Set.copyOf(retryableErrors) : Set.of();
        nonRetryableErrors = nonRetryableErrors != null ? Set.copyOf(nonRetryableErrors) : Set.of();
    }

    /**
     * Default retry policy: 3 attempts, delay doubling from 1s up to 5m.
     */
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    /**
     * Single attempt only.
     */
    public static RetryPolicy noRetry() {
        return builder()
            .maxAttempts(1)
            .initialDelay(Duration.ZERO)
            .maxDelay(Duration.ZERO)
            .multiplier(1.0)
            .jitter(0.0)
            .build();
    }

    /**
     * Compute the delay after a failed attempt.
     *
     * @param attempt 1-indexed number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration computeDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // initialDelay * multiplier ^ (attempt - 1), capped at maxDelay
        double baseMs = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        double cappedMs = Math.min(baseMs, maxDelay.toMillis());

        if (jitter == 0.0) {
            return Duration.ofMillis((long) cappedMs);
        }
        double range = cappedMs * jitter;
        double jitteredMs = cappedMs - range + ThreadLocalRandom.current().nextDouble() * 2 * range;
        return Duration.ofMillis((long) jitteredMs);
    }

    /**
     * Check if the given error code is worth another attempt.
     */
    public boolean shouldRetry(String errorCode) {
        if (errorCode != null && nonRetryableErrors.contains(errorCode)) {
            return false;
        }
        if (retryableErrors.isEmpty()) {
            return true;
        }
        return errorCode != null && retryableErrors.contains(errorCode);
    }

    /**
     * @param currentAttempt 1-indexed attempt that just finished
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    /**
     * Combined check used by the scheduler when an attempt fails.
     */
    public boolean allowsRetry(String errorCode, int currentAttempt) {
        return hasMoreAttempts(currentAttempt) && shouldRetry(errorCode);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private double jitter = 0.1;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
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
                maxAttempts, initialDelay, maxDelay,
                multiplier, jitter,
                retryableErrors, nonRetryableErrors
            );
        }
    }
}
