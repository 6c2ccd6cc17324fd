package in.flipcycle.domain.signal;

/**
 * Trade direction proposed by a signal.
 */
public enum Direction {
    BUY,
    SELL
}
