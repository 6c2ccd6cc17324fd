package in.flipcycle.application.port.output;

import java.math.BigDecimal;

/**
 * Moves accumulated reserve into the protected vault.
 */
public interface ReserveTransferPort {

    /**
     * @param amount amount to move
     * @param reference transfer id, for idempotency on the receiving side
     * @return true when the transfer was confirmed
     */
    boolean transfer(BigDecimal amount, String reference);
}
