package in.flipcycle.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Configuration for the profit siphon.
 */
public record VaultConfig(
    @JsonProperty("siphonRate")
    double siphonRate,              // share of gross profit sent to reserve (0.30 = 30%)

    @JsonProperty("minTransferAmount")
    BigDecimal minTransferAmount,   // pending reserve must exceed this before a transfer

    @JsonProperty("minimumProfit")
    BigDecimal minimumProfit,       // GLYPH_LOCK only allocates at or above this

    @JsonProperty("lockAttempts")
    int lockAttempts,

    @JsonProperty("lockTimeoutMs")
    long lockTimeoutMs
) {
    public static VaultConfig defaults() {
        return new VaultConfig(
            0.30,
            new BigDecimal("10.00"),
            new BigDecimal("0.01"),
            5,
            200
        );
    }

    @JsonIgnore
    public boolean isValid() {
        return siphonRate >= 0 && siphonRate <= 1
            && minTransferAmount != null && minTransferAmount.signum() >= 0
            && minimumProfit != null
            && lockAttempts >= 1
            && lockTimeoutMs > 0;
    }
}
