package in.flipcycle.domain.cycle;

import in.flipcycle.domain.ladder.LadderOrder;
import in.flipcycle.domain.signal.ScoreDecision;
import in.flipcycle.domain.signal.Signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One full lifecycle instance for one asset.
 *
 * Owned by the LifecycleController. Mutations happen on the cycle's runner
 * under its lock; the accessors are synchronized so monitoring threads always
 * see a consistent view.
 */
public final class FlipCycle {
    private final String cycleId;
    private final Signal signal;
    private final ScoreDecision scoreDecision;
    private final Instant startedAt;
    private final List<PhaseTransition> history = new ArrayList<>();
    private final List<String> protectiveOrderIds = new ArrayList<>();

    private FlipPhase phase;
    private CycleStatus status = CycleStatus.ACTIVE;
    private String statusReason;
    private double contextMultiplier = 0.5;
    private LadderOrder ladder;
    private TrailingStop trailingStop = TrailingStop.inactive();
    private ExitReason exitReason;
    private BigDecimal exitPrice;
    private BigDecimal realizedProfit = BigDecimal.ZERO;
    private boolean manualIntervention;
    private Signal reentrySignal;
    private Instant updatedAt;

    public FlipCycle(String cycleId, Signal signal, ScoreDecision scoreDecision, Instant startedAt) {
        this.cycleId = cycleId;
        this.signal = signal;
        this.scoreDecision = scoreDecision;
        this.startedAt = startedAt;
        this.phase = FlipPhase.SIGNAL_RECEIVED;
        this.updatedAt = startedAt;
        this.history.add(new PhaseTransition(FlipPhase.SIGNAL_RECEIVED, startedAt));
    }

    /**
     * Move to the next phase.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void advanceTo(FlipPhase next, Instant at) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                "Cycle %s cannot move from %s to %s", cycleId, phase, next));
        }
        phase = next;
        updatedAt = at;
        history.add(new PhaseTransition(next, at));
    }

    public synchronized void block(CycleStatus blockedStatus, String reason, Instant at) {
        if (!blockedStatus.isBlocked()) {
            throw new IllegalArgumentException(blockedStatus + " is not a blocked status");
        }
        this.status = blockedStatus;
        this.statusReason = reason;
        this.updatedAt = at;
    }

    public synchronized void markStatus(CycleStatus newStatus, String reason, Instant at) {
        this.status = newStatus;
        this.statusReason = reason;
        this.updatedAt = at;
    }

    public synchronized void recordExit(ExitReason reason, BigDecimal price, BigDecimal profit, Instant at) {
        this.exitReason = reason;
        this.exitPrice = price;
        this.realizedProfit = profit;
        this.updatedAt = at;
    }

    public synchronized void flagManualIntervention(String reason, Instant at) {
        this.manualIntervention = true;
        this.status = CycleStatus.MANUAL_INTERVENTION;
        this.statusReason = reason;
        this.updatedAt = at;
    }

    public synchronized void clearManualIntervention(Instant at) {
        this.manualIntervention = false;
        this.updatedAt = at;
    }

    public synchronized void updateLadder(LadderOrder ladder) {
        this.ladder = ladder;
    }

    public synchronized void updateTrailingStop(TrailingStop trailingStop) {
        this.trailingStop = trailingStop;
    }

    public synchronized void setContextMultiplier(double contextMultiplier) {
        this.contextMultiplier = contextMultiplier;
    }

    public synchronized void setReentrySignal(Signal reentrySignal) {
        this.reentrySignal = reentrySignal;
    }

    public synchronized void addProtectiveOrder(String orderId) {
        protectiveOrderIds.add(orderId);
    }

    public synchronized void removeProtectiveOrder(String orderId) {
        protectiveOrderIds.remove(orderId);
    }

    public String cycleId() { return cycleId; }
    public Signal signal() { return signal; }
    public String asset() { return signal.asset(); }
    public ScoreDecision scoreDecision() { return scoreDecision; }
    public Instant startedAt() { return startedAt; }

    public synchronized FlipPhase phase() { return phase; }
    public synchronized CycleStatus status() { return status; }
    public synchronized String statusReason() { return statusReason; }
    public synchronized double contextMultiplier() { return contextMultiplier; }
    public synchronized LadderOrder ladder() { return ladder; }
    public synchronized TrailingStop trailingStop() { return trailingStop; }
    public synchronized ExitReason exitReason() { return exitReason; }
    public synchronized BigDecimal exitPrice() { return exitPrice; }
    public synchronized BigDecimal realizedProfit() { return realizedProfit; }
    public synchronized boolean manualIntervention() { return manualIntervention; }
    public synchronized Signal reentrySignal() { return reentrySignal; }
    public synchronized Instant updatedAt() { return updatedAt; }
    public synchronized List<PhaseTransition> history() { return List.copyOf(history); }
    public synchronized List<String> protectiveOrderIds() { return List.copyOf(protectiveOrderIds); }

    public synchronized boolean isFinished() {
        return status.isFinal();
    }

    public synchronized CycleSnapshot snapshot() {
        return new CycleSnapshot(
            cycleId,
            signal.asset(),
            phase,
            status,
            statusReason,
            ladder != null ? ladder.rungs() : List.of(),
            ladder != null ? ladder.avgEntry() : null,
            ladder != null ? ladder.hardStop() : null,
            ladder != null ? ladder.takeProfit() : null,
            trailingStop.active() ? trailingStop.stopPrice() : null,
            realizedProfit,
            exitReason,
            manualIntervention,
            startedAt,
            updatedAt
        );
    }

    @Override
    public String toString() {
        return "FlipCycle[" + cycleId + " " + signal.asset() + " " + phase + " " + status + "]";
    }
}
