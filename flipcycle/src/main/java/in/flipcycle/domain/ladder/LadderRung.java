package in.flipcycle.domain.ladder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One tier of an entry ladder.
 *
 * size = allocatedCapital / price. Instances are immutable; transitions return
 * a copy.
 */
public record LadderRung(
    int tier,
    BigDecimal price,
    BigDecimal size,
    BigDecimal allocatedCapital,
    double weight,
    RungStatus status,
    String orderId,
    Instant filledAt
) {
    public static LadderRung pending(int tier, BigDecimal price, BigDecimal size,
                                     BigDecimal allocatedCapital, double weight) {
        return new LadderRung(tier, price, size, allocatedCapital, weight, RungStatus.PENDING, null, null);
    }

    public boolean isFilled() {
        return status == RungStatus.FILLED;
    }

    /**
     * Rung still waiting on the market (not filled, failed or cancelled).
     */
    public boolean isOpen() {
        return status == RungStatus.PENDING || status == RungStatus.PLACED;
    }

    /**
     * Rung with a live order at the exchange.
     */
    public boolean hasWorkingOrder() {
        return status == RungStatus.PLACED && orderId != null;
    }

    public BigDecimal value() {
        return price.multiply(size);
    }

    public LadderRung placed(String orderId) {
        return new LadderRung(tier, price, size, allocatedCapital, weight, RungStatus.PLACED, orderId, null);
    }

    public LadderRung filled(Instant at) {
        return new LadderRung(tier, price, size, allocatedCapital, weight, RungStatus.FILLED, orderId, at);
    }

    /**
     * Attach the exchange order id without changing status.
     */
    public LadderRung withOrderId(String orderId) {
        return new LadderRung(tier, price, size, allocatedCapital, weight, status, orderId, filledAt);
    }

    public LadderRung failed() {
        return new LadderRung(tier, price, size, allocatedCapital, weight, RungStatus.FAILED, orderId, null);
    }

    public LadderRung cancelled() {
        return new LadderRung(tier, price, size, allocatedCapital, weight, RungStatus.CANCELLED, orderId, null);
    }
}
