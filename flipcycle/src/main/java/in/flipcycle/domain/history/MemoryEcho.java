package in.flipcycle.domain.history;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable outcome record of one completed cycle, used to weight future
 * signals on the same asset or pattern class.
 */
public record MemoryEcho(
    @JsonProperty("cycleId")
    String cycleId,

    @JsonProperty("asset")
    String asset,

    @JsonProperty("patternClass")
    String patternClass,

    @JsonProperty("success")
    boolean success,

    @JsonProperty("profitRatio")
    double profitRatio,          // realized profit / deployed capital

    @JsonProperty("emotionalContext")
    double emotionalContext,

    @JsonProperty("volatilityContext")
    double volatilityContext,

    @JsonProperty("completedAt")
    Instant completedAt
) {
    public double successRate() {
        return success ? 1.0 : 0.0;
    }
}
