package in.flipcycle.domain.vault;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One profit-split transaction. reserveAmount = grossProfit × siphonRate.
 */
public record VaultLedgerEntry(
    String entryId,
    String cycleId,
    BigDecimal grossProfit,
    BigDecimal reserveAmount,
    BigDecimal workingRetained,
    double siphonRate,
    Instant timestamp
) {
}
