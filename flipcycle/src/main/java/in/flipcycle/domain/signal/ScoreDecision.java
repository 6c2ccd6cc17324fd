package in.flipcycle.domain.signal;

/**
 * Verdict of the signal scorer. The breakdown is returned even on rejection.
 */
public record ScoreDecision(
    ScoreBreakdown breakdown,
    boolean accepted,
    double threshold,
    String reason
) {
    public double total() {
        return breakdown.total();
    }

    public static ScoreDecision accept(ScoreBreakdown breakdown, double threshold) {
        return new ScoreDecision(breakdown, true, threshold,
            String.format("Score %.1f meets threshold %.1f", breakdown.total(), threshold));
    }

    public static ScoreDecision reject(ScoreBreakdown breakdown, double threshold) {
        return new ScoreDecision(breakdown, false, threshold,
            String.format("Score %.1f below threshold %.1f", breakdown.total(), threshold));
    }
}
