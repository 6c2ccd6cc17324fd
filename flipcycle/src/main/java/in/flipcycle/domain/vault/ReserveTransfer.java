package in.flipcycle.domain.vault;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One batched transfer of accumulated reserve to the protected vault.
 */
public record ReserveTransfer(
    String transferId,
    BigDecimal amount,
    List<String> entryIds,
    Instant timestamp
) {
    public ReserveTransfer {
        entryIds = List.copyOf(entryIds);
    }
}
