package in.flipcycle.infrastructure.metrics;

import in.flipcycle.domain.cycle.ExitReason;
import in.flipcycle.domain.cycle.FlipPhase;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Flip-cycle metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 *
 * Key metrics:
 * - Submission outcomes (admitted, rejected, blocked)
 * - Phase transitions and exits by reason
 * - Order placement and cancellation results
 * - Price feed failures
 * - Realized profit and vault reserve
 */
public interface CycleMetrics {

    /**
     * Record the outcome of a signal submission.
     *
     * @param outcome ADMITTED, REJECTED or a BLOCKED_* status name
     */
    void recordSubmission(String outcome);

    void recordPhaseTransition(FlipPhase phase);

    /**
     * Record a cycle exit.
     *
     * @param reason Exit reason
     * @param realizedProfit Realized P&amp;L of the cycle (may be negative)
     * @param duration Time from admission to exit
     */
    void recordExit(ExitReason reason, BigDecimal realizedProfit, Duration duration);

    void recordFill(String asset);

    void recordOrderPlacement(boolean success);

    void recordOrderCancellation(boolean success);

    void recordPriceFeedFailure(String asset);

    void recordVaultAllocation(BigDecimal reserveAmount);

    void recordManualIntervention();

    void setActiveCycles(int count);

    /**
     * Metrics sink that drops everything.
     */
    CycleMetrics NOOP = new CycleMetrics() {
        @Override public void recordSubmission(String outcome) {}
        @Override public void recordPhaseTransition(FlipPhase phase) {}
        @Override public void recordExit(ExitReason reason, BigDecimal realizedProfit, Duration duration) {}
        @Override public void recordFill(String asset) {}
        @Override public void recordOrderPlacement(boolean success) {}
        @Override public void recordOrderCancellation(boolean success) {}
        @Override public void recordPriceFeedFailure(String asset) {}
        @Override public void recordVaultAllocation(BigDecimal reserveAmount) {}
        @Override public void recordManualIntervention() {}
        @Override public void setActiveCycles(int count) {}
    };
}
