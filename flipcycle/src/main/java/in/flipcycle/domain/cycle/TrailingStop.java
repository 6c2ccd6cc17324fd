package in.flipcycle.domain.cycle;

import java.math.BigDecimal;

/**
 * Trailing-stop state of a cycle. Once active, highestPrice and stopPrice
 * only ever move up.
 */
public record TrailingStop(
    boolean active,
    BigDecimal highestPrice,
    BigDecimal stopPrice
) {
    public static TrailingStop inactive() {
        return new TrailingStop(false, null, null);
    }
}
