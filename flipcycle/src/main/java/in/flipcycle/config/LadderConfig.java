package in.flipcycle.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Configuration for entry-ladder construction.
 */
public record LadderConfig(
    @JsonProperty("curve")
    double curve,                   // rung spacing exponent, 1.0 = linear

    @JsonProperty("tierWeights")
    List<Double> tierWeights,       // capital share per tier, truncated and renormalized

    @JsonProperty("minTiers")
    int minTiers,

    @JsonProperty("maxTiers")
    int maxTiers,

    @JsonProperty("sizeScale")
    int sizeScale                   // decimal places of rung sizes
) {
    public LadderConfig {
        tierWeights = tierWeights != null ? List.copyOf(tierWeights) : List.of();
    }

    public static LadderConfig defaults() {
        return new LadderConfig(
            1.2,
            List.of(0.30, 0.25, 0.20, 0.15, 0.08, 0.02),
            3,
            6,
            8
        );
    }

    @JsonIgnore
    public boolean isValid() {
        return curve > 0
            && minTiers >= 1 && minTiers <= maxTiers
            && maxTiers <= tierWeights.size()
            && tierWeights.stream().allMatch(w -> w != null && w > 0)
            && sizeScale >= 0 && sizeScale <= 18;
    }
}
