package in.flipcycle.domain.cycle;

import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.ScoreDecision;
import in.flipcycle.domain.signal.ScoringWeights;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlipPhaseTest {

    @Test
    void testNumbering() {
        FlipPhase[] phases = FlipPhase.values();
        for (int i = 0; i < phases.length; i++) {
            assertEquals(i + 1, phases[i].number());
        }
    }

    @Test
    void testAllowedTransitions() {
        assertTrue(FlipPhase.SIGNAL_RECEIVED.canTransitionTo(FlipPhase.MEMORY_WEIGHTING));
        assertTrue(FlipPhase.LADDER_DEPLOYED.canTransitionTo(FlipPhase.ASHEN_FLAME));
        assertTrue(FlipPhase.LADDER_DEPLOYED.canTransitionTo(FlipPhase.WINDMARK));
        assertTrue(FlipPhase.CRYSTAL_SCAN.canTransitionTo(FlipPhase.ASHEN_FLAME));
        assertTrue(FlipPhase.ASHEN_FLAME.canTransitionTo(FlipPhase.GLYPH_LOCK));

        assertFalse(FlipPhase.ASHEN_FLAME.canTransitionTo(FlipPhase.WINDMARK), "Emergency skips WINDMARK");
        assertFalse(FlipPhase.CRYSTAL_SCAN.canTransitionTo(FlipPhase.LADDER_DEPLOYED));
        assertFalse(FlipPhase.SPEARHEAD_INVOKED.canTransitionTo(FlipPhase.CRYSTAL_SCAN));
        for (FlipPhase next : FlipPhase.values()) {
            assertFalse(FlipPhase.ECHO_IMPRINT.canTransitionTo(next));
            assertFalse(next.canTransitionTo(next), next + " must not loop");
        }
    }

    @Test
    void testTransitionsNeverGoBackwards() {
        for (FlipPhase from : FlipPhase.values()) {
            for (FlipPhase to : FlipPhase.values()) {
                if (from.canTransitionTo(to)) {
                    assertTrue(to.number() > from.number(), from + " -> " + to);
                }
            }
        }
    }

    @Test
    void testMonitoredPhases() {
        Set<FlipPhase> monitored = EnumSet.noneOf(FlipPhase.class);
        for (FlipPhase phase : FlipPhase.values()) {
            if (phase.isMonitored()) {
                monitored.add(phase);
            }
        }
        assertEquals(EnumSet.of(FlipPhase.LADDER_DEPLOYED, FlipPhase.CRYSTAL_SCAN), monitored);
    }

    @Test
    void testCycleRejectsIllegalTransition() {
        ScoreDecision decision = ScoreDecision.accept(ScoreBreakdown.uniform(80, ScoringWeights.defaults()), 60);
        FlipCycle cycle = new FlipCycle("CYC-1", TestSignals.btc().build(), decision, TestSignals.T0);

        assertThrows(IllegalStateException.class,
            () -> cycle.advanceTo(FlipPhase.LADDER_DEPLOYED, TestSignals.T0));

        cycle.advanceTo(FlipPhase.MEMORY_WEIGHTING, TestSignals.T0.plusSeconds(1));
        assertEquals(List.of(FlipPhase.SIGNAL_RECEIVED, FlipPhase.MEMORY_WEIGHTING),
            cycle.history().stream().map(PhaseTransition::phase).toList());
    }

    @Test
    void testStatusClassification() {
        assertTrue(CycleStatus.BLOCKED_CAPACITY.isBlocked());
        assertTrue(CycleStatus.BLOCKED_CAPACITY.isFinal());
        assertTrue(CycleStatus.COMPLETED.isFinal());
        assertFalse(CycleStatus.MANUAL_INTERVENTION.isFinal());
        assertFalse(CycleStatus.EMERGENCY_EXIT.isFinal());
        assertTrue(ExitReason.OVEREXPOSURE.isEmergency());
        assertFalse(ExitReason.TAKE_PROFIT.isEmergency());
    }
}
