package com.repairline.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldMatchEngineDefaults() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.initialBackoff());
        assertEquals(Duration.ofSeconds(30), policy.maxBackoff());
        assertEquals(2.0, policy.backoffMultiplier());
    }

    @Test
    void computeBackoff_shouldDoubleUntilCapped() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Duration.ofSeconds(1), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(2), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(4), policy.computeBackoff(3));
        assertEquals(Duration.ofSeconds(30), policy.computeBackoff(10));
    }

    @Test
    void computeBackoff_withJitter_shouldStayWithinRange() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(10))
            .maxBackoff(Duration.ofSeconds(30))
            .jitterFactor(0.2)
            .build();

        for (int i = 0; i < 50; i++) {
            long ms = policy.computeBackoff(1).toMillis();
            assertTrue(ms >= 8000 && ms <= 12000, "backoff out of range: " + ms);
        }
    }

    @Test
    void computeBackoff_shouldRejectZeroAttempt() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaultPolicy().computeBackoff(0));
    }

    @Test
    void noRetry_shouldAllowSingleAttemptWithoutDelay() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertFalse(policy.hasMoreAttempts(1));
        assertEquals(Duration.ZERO, policy.computeBackoff(1));
    }

    @Test
    void shouldRetry_withNonRetryableList_shouldExclude() {
        RetryPolicy policy = RetryPolicy.builder()
            .nonRetryableErrors(Set.of("VALIDATION_ERROR"))
            .build();

        assertFalse(policy.shouldRetry("VALIDATION_ERROR"));
        assertTrue(policy.shouldRetry("AGENT_UNAVAILABLE"));
    }

    @Test
    void shouldRetry_withRetryableList_shouldOnlyAllowListed() {
        RetryPolicy policy = RetryPolicy.builder()
            .retryableErrors(Set.of("AGENT_UNAVAILABLE"))
            .build();

        assertTrue(policy.shouldRetry("AGENT_UNAVAILABLE"));
        assertFalse(policy.shouldRetry("TIMEOUT"));
        assertFalse(policy.shouldRetry(null));
    }

    @Test
    void hasMoreAttempts_shouldStopAtMax() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ZERO);

        assertTrue(policy.hasMoreAttempts(1));
        assertTrue(policy.hasMoreAttempts(2));
        assertFalse(policy.hasMoreAttempts(3));
    }

    @Test
    void constructor_shouldRejectInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(10))
            .maxBackoff(Duration.ofSeconds(1))
            .build());
    }
}
