package in.flipcycle.service.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Working capital available to new cycles.
 *
 * Capital is reserved when a cycle is admitted and released when it
 * completes. Working-retained profit is credited back.
 */
public final class CapitalPool {
    private static final Logger log = LoggerFactory.getLogger(CapitalPool.class);

    private BigDecimal available;
    private BigDecimal reserved = BigDecimal.ZERO;

    public CapitalPool(BigDecimal initial) {
        this.available = initial;
    }

    /**
     * @return true if amount was available and is now reserved
     */
    public synchronized boolean tryReserve(BigDecimal amount) {
        if (amount.signum() <= 0 || available.compareTo(amount) < 0) {
            return false;
        }
        available = available.subtract(amount);
        reserved = reserved.add(amount);
        return true;
    }

    /**
     * Return reserved capital, adjusted by a realized loss (negative) if any.
     */
    public synchronized void release(BigDecimal reservedAmount, BigDecimal adjustment) {
        reserved = reserved.subtract(reservedAmount);
        available = available.add(reservedAmount).add(adjustment);
        if (available.signum() < 0) {
            log.warn("Capital pool below zero after release: {}", available);
        }
    }

    public synchronized void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    public synchronized BigDecimal available() {
        return available;
    }

    public synchronized BigDecimal reserved() {
        return reserved;
    }
}
