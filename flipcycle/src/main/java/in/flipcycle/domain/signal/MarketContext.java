package in.flipcycle.domain.signal;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Live market view used when scoring or re-scoring a signal.
 *
 * price is null when no quote could be fetched; scoring then falls back to the
 * signal's own entry band.
 */
public record MarketContext(
    BigDecimal price,
    double change24hPct,
    Instant capturedAt
) {
    public static MarketContext unavailable(Instant at) {
        return new MarketContext(null, 0.0, at);
    }

    public static MarketContext of(BigDecimal price, double change24hPct, Instant at) {
        return new MarketContext(price, change24hPct, at);
    }

    public boolean hasPrice() {
        return price != null && price.signum() > 0;
    }
}
