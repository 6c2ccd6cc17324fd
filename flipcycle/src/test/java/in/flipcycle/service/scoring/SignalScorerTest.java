package in.flipcycle.service.scoring;

import in.flipcycle.config.ScoringConfig;
import in.flipcycle.domain.history.MemoryEcho;
import in.flipcycle.domain.signal.MarketContext;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.ScoreDecision;
import in.flipcycle.domain.signal.ScoringWeights;
import in.flipcycle.domain.signal.Signal;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalScorerTest {

    private static SignalScorer fixed(double score) {
        ScoringStrategy strategy = (signal, context) -> ScoreBreakdown.uniform(score, ScoringWeights.defaults());
        return new SignalScorer(strategy, ScoringConfig.defaults());
    }

    @Test
    void testAcceptsAtThreshold() {
        ScoreDecision decision = fixed(60.0).score(TestSignals.btc().build(),
            MarketContext.unavailable(TestSignals.T0), List.of());

        assertTrue(decision.accepted());
        assertEquals(60.0, decision.total(), 1e-9);
        assertEquals(60.0, decision.threshold(), 1e-9);
    }

    @Test
    void testRejectsBelowThresholdButKeepsBreakdown() {
        ScoreDecision decision = fixed(59.9).score(TestSignals.btc().build(),
            MarketContext.unavailable(TestSignals.T0), null);

        assertFalse(decision.accepted());
        assertNotNull(decision.breakdown());
        assertTrue(decision.reason().contains("below threshold"), decision.reason());
    }

    @Test
    void testHistoryDoesNotChangeDecision() {
        Signal signal = TestSignals.btc().build();
        List<MemoryEcho> losses = List.of(
            new MemoryEcho("C1", "BTC/USDT", "MOMENTUM", false, -0.05, 0.5, 0.03, TestSignals.T0),
            new MemoryEcho("C2", "BTC/USDT", "MOMENTUM", false, -0.02, 0.5, 0.03, TestSignals.T0));

        SignalScorer scorer = fixed(70.0);
        ScoreDecision withHistory = scorer.score(signal, MarketContext.unavailable(TestSignals.T0), losses);
        ScoreDecision without = scorer.score(signal, MarketContext.unavailable(TestSignals.T0), List.of());

        assertEquals(without.total(), withHistory.total(), 1e-9);
        assertEquals(without.accepted(), withHistory.accepted());
    }

    @Test
    void testAdjustIsNeutralAtHalfAndBoundedByBand() {
        SignalScorer scorer = fixed(80.0);

        assertEquals(80.0, scorer.adjust(80.0, 0.5), 1e-9);
        assertEquals(88.0, scorer.adjust(80.0, 1.0), 1e-9);
        assertEquals(72.0, scorer.adjust(80.0, 0.0), 1e-9);
        assertEquals(100.0, scorer.adjust(95.0, 1.0), 1e-9, "Clamped to 100");
        assertEquals(72.0, scorer.adjust(80.0, -3.0), 1e-9, "Multiplier clamped to 0");
    }

    @Test
    void testRescoreAppliesMultiplier() {
        ScoringStrategy strategy = new ScoringStrategy() {
            @Override
            public ScoreBreakdown evaluate(Signal signal, MarketContext context) {
                return ScoreBreakdown.uniform(90.0, ScoringWeights.defaults());
            }

            @Override
            public ScoreBreakdown reevaluate(Signal signal, MarketContext context) {
                return ScoreBreakdown.uniform(50.0, ScoringWeights.defaults());
            }
        };
        SignalScorer scorer = new SignalScorer(strategy, ScoringConfig.defaults());

        assertEquals(45.0, scorer.rescore(TestSignals.btc().build(),
            MarketContext.unavailable(TestSignals.T0), 0.0), 1e-9);
        assertEquals(40.0, scorer.cognitiveExitThreshold(), 1e-9);
    }
}
