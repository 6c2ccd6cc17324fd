package in.flipcycle.domain.signal;

/**
 * Multi-factor evaluation of a signal. Every component is on a 0-100 scale and
 * the total is the weighted sum, clamped to 0-100.
 */
public record ScoreBreakdown(
    double signalQuality,
    double riskReward,
    double marketConditions,
    double positionSizing,
    double longTermAlignment,
    ScoringWeights weights,
    double total
) {
    public static ScoreBreakdown of(double signalQuality, double riskReward, double marketConditions,
                                    double positionSizing, double longTermAlignment,
                                    ScoringWeights weights) {
        double q = clamp(signalQuality);
        double rr = clamp(riskReward);
        double mc = clamp(marketConditions);
        double ps = clamp(positionSizing);
        double lt = clamp(longTermAlignment);

        double total = (q * weights.signalQuality()
            + rr * weights.riskReward()
            + mc * weights.marketConditions()
            + ps * weights.positionSizing()
            + lt * weights.longTermAlignment()) / ScoringWeights.TOTAL;

        return new ScoreBreakdown(q, rr, mc, ps, lt, weights, clamp(total));
    }

    /**
     * Fixed-score breakdown for strategies that produce a total directly.
     */
    public static ScoreBreakdown uniform(double score, ScoringWeights weights) {
        return of(score, score, score, score, score, weights);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
