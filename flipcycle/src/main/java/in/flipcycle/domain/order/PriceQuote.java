package in.flipcycle.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One price-feed reading.
 */
public record PriceQuote(
    String asset,
    BigDecimal price,
    double change24hPct,
    Instant timestamp
) {
}
