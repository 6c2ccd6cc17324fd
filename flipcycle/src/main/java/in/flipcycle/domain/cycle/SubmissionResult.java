package in.flipcycle.domain.cycle;

import in.flipcycle.domain.common.FlipErrorCode;
import in.flipcycle.domain.signal.ScoreDecision;

/**
 * Outcome of submitting a signal to the lifecycle controller.
 *
 * cycleId is null when the signal was rejected at SIGNAL_RECEIVED (no cycle is
 * created). Blocked cycles carry their id and a BLOCKED_* status.
 */
public record SubmissionResult(
    String cycleId,
    CycleStatus status,
    FlipErrorCode errorCode,
    String reason,
    ScoreDecision decision
) {
    public static SubmissionResult rejected(FlipErrorCode code, String reason, ScoreDecision decision) {
        return new SubmissionResult(null, null, code, reason, decision);
    }

    public static SubmissionResult blocked(String cycleId, CycleStatus status, FlipErrorCode code,
                                           String reason, ScoreDecision decision) {
        return new SubmissionResult(cycleId, status, code, reason, decision);
    }

    public static SubmissionResult admitted(String cycleId, ScoreDecision decision) {
        return new SubmissionResult(cycleId, CycleStatus.ACTIVE, null, "Ladder deployed", decision);
    }

    public boolean isAdmitted() {
        return status == CycleStatus.ACTIVE;
    }

    public boolean isRejected() {
        return cycleId == null;
    }
}
