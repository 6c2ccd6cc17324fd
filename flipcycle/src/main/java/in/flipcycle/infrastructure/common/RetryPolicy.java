package in.flipcycle.infrastructure.common;

import in.flipcycle.config.LifecycleConfig;

import java.time.Duration;

/**
 * Retry policy with exponential backoff for exchange calls.
 *
 * One instance tracks one operation (for example cancelling one order).
 * After maxAttempts failures the policy is exhausted and shouldRetry()
 * returns false until recordSuccess.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.forOrders(config);
 * while (policy.shouldRetry()) {
 *     if (cancel(orderId)) {
 *         policy.recordSuccess();
 *         break;
 *     }
 *     Duration delay = policy.getNextDelay();
 *     policy.recordFailure();
 *     sleeper.sleep(delay);
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private boolean exhausted = false;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true if another attempt may be made
     */
    public synchronized boolean shouldRetry() {
        return !exhausted && attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the delay, capped at maxDelay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
        if (attemptCount >= maxAttempts) {
            exhausted = true;
        }
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        exhausted = false;
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy for exchange order calls (cancellation, exit orders), from
     * lifecycle settings.
     */
    public static RetryPolicy forOrders(LifecycleConfig config) {
        return builder()
            .initialDelay(Duration.ofMillis(config.cancelBaseDelayMs()))
            .maxDelay(Duration.ofMillis(config.cancelMaxDelayMs()))
            .multiplier(2.0)
            .maxAttempts(config.cancelMaxAttempts())
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
