package in.flipcycle.domain.ladder;

/**
 * Lifecycle of one ladder rung.
 *
 * PENDING → PLACED → FILLED
 *         ↘ FAILED   ↘ CANCELLED
 *
 * FILLED, FAILED and CANCELLED are terminal; a filled rung never un-fills.
 */
public enum RungStatus {
    PENDING,
    PLACED,
    FILLED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == FAILED || this == CANCELLED;
    }
}
