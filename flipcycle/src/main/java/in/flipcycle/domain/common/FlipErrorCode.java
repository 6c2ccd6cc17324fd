package in.flipcycle.domain.common;

/**
 * Error kinds surfaced by the flip lifecycle.
 */
public enum FlipErrorCode {
    SIGNAL_INVALID,
    SCORE_BELOW_THRESHOLD,
    CONTEXT_TOO_WEAK,
    INSUFFICIENT_CAPITAL,
    MAX_CONCURRENT_CYCLES,
    ASSET_ALREADY_ACTIVE,
    PRICE_FEED_UNAVAILABLE,
    ORDER_PLACEMENT_FAILED,
    EMERGENCY_EXIT_PARTIAL_FAILURE,
    VAULT_WRITE_CONFLICT
}
