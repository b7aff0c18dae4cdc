package com.repairline.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff for task invocations.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
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
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default task retry: 3 attempts, 1s doubling up to 30s.
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
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .backoffMultiplier(1.0)
            .build();
    }

    /**
     * Fixed delay between a bounded number of attempts.
     */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return builder()
            .maxAttempts(maxAttempts)
            .initialBackoff(delay)
            .maxBackoff(delay)
            .backoffMultiplier(1.0)
            .build();
    }

    /**
     * Backoff to wait after the given failed attempt.
     *
     * @param attemptNumber 1-indexed attempt that just failed
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // initialBackoff * multiplier^(attempt - 1), capped
        double baseMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attemptNumber - 1);
        double cappedMs = Math.min(baseMs, maxBackoff.toMillis());

        if (jitterFactor == 0.0 || cappedMs == 0.0) {
            return Duration.ofMillis((long) cappedMs);
        }

        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        return Duration.ofMillis((long) Math.min(jitteredMs, maxBackoff.toMillis()));
    }

    /**
     * Whether the given error code may be retried at all.
     * Non-retryable codes always win; an empty retryable set allows everything else.
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
     * @param currentAttempt 1-indexed attempt just made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.0;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
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
