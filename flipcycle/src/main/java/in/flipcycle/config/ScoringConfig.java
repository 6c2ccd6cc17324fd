package in.flipcycle.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.flipcycle.domain.signal.ScoringWeights;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for signal scoring.
 *
 * The acceptance threshold (rejectionThreshold) and the cognitive-exit
 * threshold are independent: a running cycle is only abandoned when its
 * re-score falls well below the bar it had to clear to start.
 */
public record ScoringConfig(
    @JsonProperty("weights")
    ScoringWeights weights,

    @JsonProperty("rejectionThreshold")
    double rejectionThreshold,          // total below this is NO-GO (0-100)

    @JsonProperty("cognitiveExitThreshold")
    double cognitiveExitThreshold,      // adjusted re-score below this exits (0-100)

    @JsonProperty("multiplierBand")
    double multiplierBand,              // memory multiplier moves the score by at most ±band

    @JsonProperty("referenceAccount")
    BigDecimal referenceAccount,        // account size for the position-sizing factor

    @JsonProperty("majorAssets")
    List<String> majorAssets,

    @JsonProperty("midAssets")
    List<String> midAssets,

    @JsonProperty("holdAssets")
    List<String> holdAssets,            // long-term holds, BUY aligned

    @JsonProperty("activeAssets")
    List<String> activeAssets           // actively traded either way
) {
    public ScoringConfig {
        majorAssets = majorAssets != null ? List.copyOf(majorAssets) : List.of();
        midAssets = midAssets != null ? List.copyOf(midAssets) : List.of();
        holdAssets = holdAssets != null ? List.copyOf(holdAssets) : List.of();
        activeAssets = activeAssets != null ? List.copyOf(activeAssets) : List.of();
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(
            ScoringWeights.defaults(),
            60.0,
            40.0,
            0.10,
            new BigDecimal("10000"),
            List.of("BTC", "ETH"),
            List.of("SOL", "XRP", "ADA", "AVAX", "LINK", "DOT"),
            List.of("BTC", "ETH", "SOL"),
            List.of("XRP", "ADA", "AVAX", "LINK")
        );
    }

    @JsonIgnore
    public boolean isValid() {
        return weights != null
            && rejectionThreshold >= 0 && rejectionThreshold <= 100
            && cognitiveExitThreshold >= 0 && cognitiveExitThreshold <= 100
            && multiplierBand >= 0 && multiplierBand <= 0.5
            && referenceAccount != null && referenceAccount.signum() > 0;
    }

    public boolean isMajor(String asset) {
        return majorAssets.contains(baseSymbol(asset));
    }

    public boolean isMid(String asset) {
        return midAssets.contains(baseSymbol(asset));
    }

    public boolean isHold(String asset) {
        return holdAssets.contains(baseSymbol(asset));
    }

    public boolean isActive(String asset) {
        return activeAssets.contains(baseSymbol(asset));
    }

    /**
     * "btc/usdt", "BTC-USD" and "BTC" all map to "BTC".
     */
    static String baseSymbol(String asset) {
        if (asset == null) {
            return "";
        }
        String upper = asset.trim().toUpperCase(Locale.ROOT);
        int slash = upper.indexOf('/');
        int dash = upper.indexOf('-');
        int cut = slash >= 0 ? slash : dash;
        return cut > 0 ? upper.substring(0, cut) : upper;
    }
}
