package in.flipcycle.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration for the lifecycle controller: timers, admission gate,
 * crystal scan, re-entry and order cancellation.
 */
public record LifecycleConfig(
    @JsonProperty("initialCapital")
    BigDecimal initialCapital,

    @JsonProperty("maxConcurrentCycles")
    int maxConcurrentCycles,

    @JsonProperty("minContextMultiplier")
    double minContextMultiplier,

    @JsonProperty("memoryLookbackDays")
    int memoryLookbackDays,

    @JsonProperty("pollIntervalSeconds")
    long pollIntervalSeconds,

    @JsonProperty("cognitiveIntervalSeconds")
    long cognitiveIntervalSeconds,

    @JsonProperty("decayWindowMinutes")
    long decayWindowMinutes,

    @JsonProperty("priceTimeoutMs")
    long priceTimeoutMs,

    @JsonProperty("orderTimeoutMs")
    long orderTimeoutMs,            // bound on a single exchange call

    @JsonProperty("priceFailureWarnThreshold")
    int priceFailureWarnThreshold,  // consecutive failed polls before a warning

    @JsonProperty("overexposureThreshold")
    double overexposureThreshold,   // active cycles / max cycles

    @JsonProperty("scoreDecayPerHour")
    double scoreDecayPerHour,       // crystal-scan decay of the original score

    @JsonProperty("scoreDecayFloor")
    double scoreDecayFloor,         // never below this share of the original score

    @JsonProperty("riskSignalThreshold")
    double riskSignalThreshold,

    @JsonProperty("reentryWindowMinutes")
    long reentryWindowMinutes,

    @JsonProperty("reentryMemoryMatch")
    double reentryMemoryMatch,

    @JsonProperty("cancelMaxAttempts")
    int cancelMaxAttempts,

    @JsonProperty("cancelBaseDelayMs")
    long cancelBaseDelayMs,

    @JsonProperty("cancelMaxDelayMs")
    long cancelMaxDelayMs,

    @JsonProperty("cancelTimeoutMs")
    long cancelTimeoutMs            // hard limit before manual intervention
) {
    public static LifecycleConfig defaults() {
        return new LifecycleConfig(
            new BigDecimal("10000"),
            5,
            0.25,
            7,
            30,
            30,
            15,
            5_000,
            10_000,
            3,
            0.8,
            0.10,
            0.50,
            0.8,
            120,
            0.7,
            5,
            200,
            5_000,
            30_000
        );
    }

    @JsonIgnore
    public boolean isValid() {
        return initialCapital != null && initialCapital.signum() >= 0
            && maxConcurrentCycles >= 1
            && minContextMultiplier >= 0 && minContextMultiplier <= 1
            && memoryLookbackDays >= 1
            && pollIntervalSeconds >= 1
            && cognitiveIntervalSeconds >= 1
            && decayWindowMinutes >= 1
            && priceTimeoutMs > 0
            && orderTimeoutMs > 0
            && priceFailureWarnThreshold >= 1
            && overexposureThreshold > 0 && overexposureThreshold <= 1
            && scoreDecayPerHour >= 0 && scoreDecayPerHour <= 1
            && scoreDecayFloor >= 0 && scoreDecayFloor <= 1
            && riskSignalThreshold >= 0 && riskSignalThreshold <= 1
            && reentryWindowMinutes >= 0
            && reentryMemoryMatch >= 0 && reentryMemoryMatch <= 1
            && cancelMaxAttempts >= 1
            && cancelBaseDelayMs > 0 && cancelMaxDelayMs >= cancelBaseDelayMs
            && cancelTimeoutMs > 0;
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    public Duration cognitiveInterval() {
        return Duration.ofSeconds(cognitiveIntervalSeconds);
    }

    public Duration decayWindow() {
        return Duration.ofMinutes(decayWindowMinutes);
    }

    /**
     * Crystal scan runs half way through the decay window.
     */
    public Duration crystalScanDelay() {
        return decayWindow().dividedBy(2);
    }

    public Duration priceTimeout() {
        return Duration.ofMillis(priceTimeoutMs);
    }

    public Duration orderTimeout() {
        return Duration.ofMillis(orderTimeoutMs);
    }

    public Duration memoryLookback() {
        return Duration.ofDays(memoryLookbackDays);
    }

    public Duration reentryWindow() {
        return Duration.ofMinutes(reentryWindowMinutes);
    }
}
