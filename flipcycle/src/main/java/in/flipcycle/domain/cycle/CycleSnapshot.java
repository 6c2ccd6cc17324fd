package in.flipcycle.domain.cycle;

import in.flipcycle.domain.ladder.LadderRung;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Persisted view of one cycle, written at every phase change.
 *
 * ladder fields are null for cycles blocked before deployment; trailingStop is
 * null until the trailing stop activates.
 */
public record CycleSnapshot(
    String cycleId,
    String asset,
    FlipPhase phase,
    CycleStatus status,
    String statusReason,
    List<LadderRung> rungs,
    BigDecimal avgEntry,
    BigDecimal hardStop,
    BigDecimal takeProfit,
    BigDecimal trailingStop,
    BigDecimal realizedProfit,
    ExitReason exitReason,
    boolean manualIntervention,
    Instant startedAt,
    Instant updatedAt
) {
}
