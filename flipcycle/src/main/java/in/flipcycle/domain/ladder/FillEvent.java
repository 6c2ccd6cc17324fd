package in.flipcycle.domain.ladder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Emitted once per rung transition to FILLED.
 */
public record FillEvent(
    String asset,
    int tier,
    BigDecimal price,
    BigDecimal size,
    BigDecimal avgEntryAfter,
    BigDecimal filledSizeAfter,
    Instant filledAt
) {
}
