package in.flipcycle.application.service;

import in.flipcycle.application.monitoring.AlertService;
import in.flipcycle.config.ConfigLoader;
import in.flipcycle.domain.cycle.CycleStatus;
import in.flipcycle.domain.cycle.FlipCycle;
import in.flipcycle.domain.cycle.SubmissionResult;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.ScoringWeights;
import in.flipcycle.domain.signal.Signal;
import in.flipcycle.infrastructure.paper.PaperExchange;
import in.flipcycle.infrastructure.persistence.InMemoryCycleSnapshotRepository;
import in.flipcycle.service.history.InMemoryHistoryStore;
import in.flipcycle.support.MutableClock;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every admitted cycle either completes or is flagged for manual
 * intervention, even with a flaky feed and flaky cancellations.
 */
class LifecycleLivenessTest {

    private static final Map<String, Double> MARKETS = Map.of(
        "BTC/USDT", 100.0,
        "ETH/USDT", 2000.0,
        "SOL/USDT", 150.0,
        "XRP/USDT", 0.6,
        "ADA/USDT", 0.5);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testCyclesTerminateUnderRandomFailures() throws Exception {
        MutableClock clock = new MutableClock(TestSignals.T0);
        PaperExchange paper = new PaperExchange(clock, new Random(42));
        LifecycleController controller = LifecycleController.builder()
            .config(ConfigLoader.parse("{\"lifecycle\": {\"pollIntervalSeconds\": 3600, "
                + "\"cognitiveIntervalSeconds\": 3600, \"decayWindowMinutes\": 600}}"))
            .priceFeed(paper)
            .exchange(paper)
            .alerts(new AlertService())
            .snapshots(new InMemoryCycleSnapshotRepository())
            .history(new InMemoryHistoryStore())
            .reserveTransfer((amount, reference) -> true)
            .scheduler(scheduler)
            .scoringStrategy((signal, context) -> ScoreBreakdown.uniform(80, ScoringWeights.defaults()))
            .clock(clock)
            .sleeper(duration -> { })
            .build();

        List<Signal> signals = new ArrayList<>();
        for (Map.Entry<String, Double> market : MARKETS.entrySet()) {
            paper.setPrice(market.getKey(), BigDecimal.valueOf(market.getValue()));
            signals.add(TestSignals.forAsset(market.getKey(), market.getValue()).immediateExecution(true).build());
        }
        List<String> cycleIds = new ArrayList<>();
        for (Signal signal : signals) {
            SubmissionResult result = controller.submit(signal);
            assertTrue(result.isAdmitted(), "Expected admission for " + signal.asset() + ": " + result);
            cycleIds.add(result.cycleId());
        }

        paper.setFailureRates(0.3, 0.3);

        for (int step = 0; step < 200; step++) {
            paper.randomWalk(0.01);
            for (String cycleId : cycleIds) {
                controller.runner(cycleId).ifPresent(CycleRunner::pollNow);
            }
        }
        for (String cycleId : cycleIds) {
            controller.runner(cycleId).ifPresent(CycleRunner::decayNow);
        }

        // Lift every market over its take-profit and keep polling
        for (Signal signal : signals) {
            BigDecimal lifted = signal.entryHigh().multiply(new BigDecimal("1.3")).setScale(8, RoundingMode.HALF_UP);
            paper.setPrice(signal.asset(), lifted);
        }
        for (int round = 0; round < 50; round++) {
            for (String cycleId : cycleIds) {
                Optional<CycleRunner> runner = controller.runner(cycleId);
                if (runner.isPresent() && !runner.get().isStopped()) {
                    runner.get().pollNow();
                }
            }
        }

        BigDecimal heldCapital = BigDecimal.ZERO;
        int flagged = 0;
        for (String cycleId : cycleIds) {
            FlipCycle cycle = controller.cycle(cycleId).orElseThrow();
            assertTrue(cycle.status() == CycleStatus.COMPLETED || cycle.manualIntervention(),
                cycleId + " stuck in " + cycle.phase() + " / " + cycle.status());
            if (cycle.manualIntervention()) {
                flagged++;
                heldCapital = heldCapital.add(cycle.signal().capital());
            }
        }
        assertEquals(flagged, controller.activeCycleCount(), "Only flagged cycles keep a slot");
        assertEquals(0, heldCapital.compareTo(controller.capitalPool().reserved()));
    }
}
