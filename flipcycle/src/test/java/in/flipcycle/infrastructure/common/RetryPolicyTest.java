package in.flipcycle.infrastructure.common;

import in.flipcycle.config.LifecycleConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Exhaustion after max attempts
 * - Reset functionality
 * - Builder validation
 */
class RetryPolicyTest {

    @Test
    void testInitialState() {
        RetryPolicy policy = RetryPolicy.builder().build();

        assertTrue(policy.shouldRetry(), "Should allow the first attempt");
        assertEquals(0, policy.getAttemptCount());
        assertFalse(policy.isExhausted());
        assertEquals(Duration.ofMillis(200), policy.getNextDelay());
    }

    @Test
    void testExponentialBackoffCapped() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(500))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        policy.recordFailure();
        assertEquals(Duration.ofMillis(200), policy.getNextDelay());
        policy.recordFailure();
        assertEquals(Duration.ofMillis(400), policy.getNextDelay());
        policy.recordFailure();
        assertEquals(Duration.ofMillis(500), policy.getNextDelay(), "Capped at max delay");
        policy.recordFailure();
        assertEquals(Duration.ofMillis(500), policy.getNextDelay());
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.shouldRetry());
        policy.recordFailure();

        assertFalse(policy.shouldRetry());
        assertTrue(policy.isExhausted());
        assertEquals(3, policy.getAttemptCount());
    }

    @Test
    void testSuccessResets() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(2).build();
        policy.recordFailure();
        policy.recordFailure();

        policy.recordSuccess();

        assertTrue(policy.shouldRetry());
        assertEquals(0, policy.getAttemptCount());
        assertEquals(Duration.ofMillis(200), policy.getNextDelay());
    }

    @Test
    void testForOrdersUsesLifecycleSettings() {
        RetryPolicy policy = RetryPolicy.forOrders(LifecycleConfig.defaults());

        assertEquals(Duration.ofMillis(200), policy.getNextDelay());
        for (int i = 0; i < 5; i++) {
            assertTrue(policy.shouldRetry());
            policy.recordFailure();
        }
        assertFalse(policy.shouldRetry());
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxDelay(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(1))
            .build());
    }
}
