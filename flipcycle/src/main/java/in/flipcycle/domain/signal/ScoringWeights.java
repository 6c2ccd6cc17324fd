package in.flipcycle.domain.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Percentage weights of the five scoring factors. Must sum to exactly 100.
 */
public record ScoringWeights(
    @JsonProperty("signalQuality")
    int signalQuality,

    @JsonProperty("riskReward")
    int riskReward,

    @JsonProperty("marketConditions")
    int marketConditions,

    @JsonProperty("positionSizing")
    int positionSizing,

    @JsonProperty("longTermAlignment")
    int longTermAlignment
) {
    public static final int TOTAL = 100;

    public ScoringWeights {
        int sum = signalQuality + riskReward + marketConditions + positionSizing + longTermAlignment;
        if (sum != TOTAL) {
            throw new IllegalArgumentException("Scoring weights must sum to 100, got " + sum);
        }
        if (signalQuality < 0 || riskReward < 0 || marketConditions < 0
                || positionSizing < 0 || longTermAlignment < 0) {
            throw new IllegalArgumentException("Scoring weights cannot be negative");
        }
    }

    /**
     * quality 20, risk/reward 25, market 15, sizing 15, alignment 25.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(20, 25, 15, 15, 25);
    }

    public int sum() {
        return signalQuality + riskReward + marketConditions + positionSizing + longTermAlignment;
    }
}
