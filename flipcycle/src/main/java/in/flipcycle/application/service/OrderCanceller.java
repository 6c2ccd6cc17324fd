package in.flipcycle.application.service;

import in.flipcycle.application.port.output.ExchangeConnector;
import in.flipcycle.config.LifecycleConfig;
import in.flipcycle.infrastructure.common.RetryPolicy;
import in.flipcycle.infrastructure.common.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancels exchange orders with exponential backoff.
 *
 * Cancellation is idempotent at the exchange, so a retry after a lost
 * confirmation is safe. Each order gets its own RetryPolicy; the whole batch
 * is bounded by cancelTimeoutMs. Orders still unconfirmed afterwards are
 * returned as failed and the caller escalates to manual intervention.
 *
 * Backoff sleeps block the calling thread, which is a runner thread of the
 * shared scheduler, for up to cancelTimeoutMs. The scheduler needs a thread
 * per concurrently exiting cycle plus one so polls of other cycles keep
 * running (see App#schedulerThreads).
 */
public final class OrderCanceller {
    private static final Logger log = LoggerFactory.getLogger(OrderCanceller.class);

    private final ExchangeConnector exchange;
    private final LifecycleConfig config;
    private final Sleeper sleeper;
    private final Clock clock;

    public OrderCanceller(ExchangeConnector exchange, LifecycleConfig config, Sleeper sleeper, Clock clock) {
        this.exchange = exchange;
        this.config = config;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Outcome of a batch cancellation.
     */
    public record Result(List<String> cancelled, List<String> failed) {
        public Result {
            cancelled = List.copyOf(cancelled);
            failed = List.copyOf(failed);
        }

        public boolean allCancelled() {
            return failed.isEmpty();
        }
    }

    public Result cancelAll(String cycleId, Collection<String> orderIds) {
        Instant deadline = clock.instant().plusMillis(config.cancelTimeoutMs());
        List<String> cancelled = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String orderId : orderIds) {
            if (cancelOne(cycleId, orderId, deadline)) {
                cancelled.add(orderId);
            } else {
                failed.add(orderId);
            }
        }

        if (!failed.isEmpty()) {
            log.error("❌ Cycle {}: {} of {} orders not cancelled: {}",
                cycleId, failed.size(), orderIds.size(), failed);
        } else if (!cancelled.isEmpty()) {
            log.info("Cycle {}: cancelled {} orders", cycleId, cancelled.size());
        }
        return new Result(cancelled, failed);
    }

    private boolean cancelOne(String cycleId, String orderId, Instant deadline) {
        RetryPolicy policy = RetryPolicy.forOrders(config);
        while (policy.shouldRetry()) {
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            if (remaining <= 0) {
                log.warn("Cycle {}: cancel timeout reached for {}", cycleId, orderId);
                return false;
            }
            if (tryCancel(orderId, remaining)) {
                policy.recordSuccess();
                return true;
            }
            Duration delay = policy.getNextDelay();
            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            log.warn("Cycle {}: cancel of {} not confirmed (attempt {}), retrying in {}ms",
                cycleId, orderId, policy.getAttemptCount(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    private boolean tryCancel(String orderId, long timeoutMs) {
        try {
            Boolean confirmed = exchange.cancelOrder(orderId).get(timeoutMs, TimeUnit.MILLISECONDS);
            return Boolean.TRUE.equals(confirmed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Cancel {} failed: {}", orderId, e.getMessage());
            return false;
        }
    }
}
