package in.flipcycle.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration for exit conditions. Percentages are whole numbers
 * (3.0 = 3%).
 */
public record ExitConfig(
    @JsonProperty("hardStopPercent")
    double hardStopPercent,         // below the lowest rung

    @JsonProperty("takeProfitPercent")
    double takeProfitPercent,       // above the highest rung

    @JsonProperty("trailingActivationPercent")
    double trailingActivationPercent,   // gain over avg entry before the trail arms

    @JsonProperty("trailingPercent")
    double trailingPercent,         // distance below the highest price seen

    @JsonProperty("protectiveOrdersEnabled")
    boolean protectiveOrdersEnabled // rest a take-profit limit sell after the first fill
) {
    /**
     * Default configuration.
     */
    public static ExitConfig defaults() {
        return new ExitConfig(
            5.0,    // hard stop 5% under the ladder
            10.0,   // take profit 10% over the ladder
            3.0,    // arm trailing stop at +3%
            1.5,    // trail 1.5% below the high
            false
        );
    }

    @JsonIgnore
    public boolean isValid() {
        return hardStopPercent > 0 && hardStopPercent < 100
            && takeProfitPercent > 0 && takeProfitPercent <= 1000
            && trailingActivationPercent > 0 && trailingActivationPercent <= 100
            && trailingPercent > 0 && trailingPercent < 100;
    }

    public double hardStopFraction() {
        return hardStopPercent / 100.0;
    }

    public double takeProfitFraction() {
        return takeProfitPercent / 100.0;
    }

    public double trailingActivationFraction() {
        return trailingActivationPercent / 100.0;
    }

    public double trailingFraction() {
        return trailingPercent / 100.0;
    }
}
