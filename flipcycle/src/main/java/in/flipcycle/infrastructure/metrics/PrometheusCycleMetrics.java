package in.flipcycle.infrastructure.metrics;

import in.flipcycle.domain.cycle.ExitReason;
import in.flipcycle.domain.cycle.FlipPhase;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Prometheus implementation of CycleMetrics.
 *
 * Key Metrics:
 * - flip_submissions_total{outcome}
 * - flip_phase_transitions_total{phase}
 * - flip_exits_total{reason}
 * - flip_cycle_duration_seconds
 * - flip_realized_profit_total
 * - flip_fills_total{asset}
 * - flip_orders_total{status}, flip_order_cancellations_total{status}
 * - flip_price_feed_failures_total{asset}
 * - flip_vault_reserve_total
 * - flip_manual_interventions_total
 * - flip_active_cycles
 */
public class PrometheusCycleMetrics implements CycleMetrics {

    private final CollectorRegistry registry;

    private final Counter submissionCounter;
    private final Counter phaseCounter;
    private final Counter exitCounter;
    private final Histogram cycleDuration;
    private final Counter realizedProfit;
    private final Counter realizedLoss;
    private final Counter fillCounter;
    private final Counter orderCounter;
    private final Counter cancellationCounter;
    private final Counter priceFeedFailures;
    private final Counter vaultReserve;
    private final Counter manualInterventions;
    private final Gauge activeCycles;

    public PrometheusCycleMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusCycleMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.submissionCounter = Counter.build()
            .name("flip_submissions_total")
            .help("Signal submissions by outcome")
            .labelNames("outcome")
            .register(registry);

        this.phaseCounter = Counter.build()
            .name("flip_phase_transitions_total")
            .help("Phase transitions by target phase")
            .labelNames("phase")
            .register(registry);

        this.exitCounter = Counter.build()
            .name("flip_exits_total")
            .help("Cycle exits by reason")
            .labelNames("reason")
            .register(registry);

        this.cycleDuration = Histogram.build()
            .name("flip_cycle_duration_seconds")
            .help("Time from admission to exit in seconds")
            .buckets(60, 300, 900, 1800, 3600, 4 * 3600, 12 * 3600, 24 * 3600)
            .register(registry);

        this.realizedProfit = Counter.build()
            .name("flip_realized_profit_total")
            .help("Sum of positive realized profit")
            .register(registry);

        this.realizedLoss = Counter.build()
            .name("flip_realized_loss_total")
            .help("Sum of realized losses (absolute)")
            .register(registry);

        this.fillCounter = Counter.build()
            .name("flip_fills_total")
            .help("Ladder rung fills")
            .labelNames("asset")
            .register(registry);

        this.orderCounter = Counter.build()
            .name("flip_orders_total")
            .help("Order placements by status")
            .labelNames("status")
            .register(registry);

        this.cancellationCounter = Counter.build()
            .name("flip_order_cancellations_total")
            .help("Order cancellations by status")
            .labelNames("status")
            .register(registry);

        this.priceFeedFailures = Counter.build()
            .name("flip_price_feed_failures_total")
            .help("Failed price polls")
            .labelNames("asset")
            .register(registry);

        this.vaultReserve = Counter.build()
            .name("flip_vault_reserve_total")
            .help("Profit siphoned to the reserve")
            .register(registry);

        this.manualInterventions = Counter.build()
            .name("flip_manual_interventions_total")
            .help("Cycles flagged for manual intervention")
            .register(registry);

        this.activeCycles = Gauge.build()
            .name("flip_active_cycles")
            .help("Currently ACTIVE cycles")
            .register(registry);
    }

    @Override
    public void recordSubmission(String outcome) {
        submissionCounter.labels(outcome).inc();
    }

    @Override
    public void recordPhaseTransition(FlipPhase phase) {
        phaseCounter.labels(phase.name()).inc();
    }

    @Override
    public void recordExit(ExitReason reason, BigDecimal profit, Duration duration) {
        exitCounter.labels(reason.name()).inc();
        cycleDuration.observe(duration.toMillis() / 1000.0);
        if (profit != null && profit.signum() > 0) {
            realizedProfit.inc(profit.doubleValue());
        } else if (profit != null && profit.signum() < 0) {
            realizedLoss.inc(profit.negate().doubleValue());
        }
    }

    @Override
    public void recordFill(String asset) {
        fillCounter.labels(asset).inc();
    }

    @Override
    public void recordOrderPlacement(boolean success) {
        orderCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordOrderCancellation(boolean success) {
        cancellationCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordPriceFeedFailure(String asset) {
        priceFeedFailures.labels(asset).inc();
    }

    @Override
    public void recordVaultAllocation(BigDecimal reserveAmount) {
        if (reserveAmount != null && reserveAmount.signum() > 0) {
            vaultReserve.inc(reserveAmount.doubleValue());
        }
    }

    @Override
    public void recordManualIntervention() {
        manualInterventions.inc();
    }

    @Override
    public void setActiveCycles(int count) {
        activeCycles.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
