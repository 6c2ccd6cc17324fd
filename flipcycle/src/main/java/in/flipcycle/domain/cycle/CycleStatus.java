package in.flipcycle.domain.cycle;

/**
 * Status of a flip cycle. BLOCKED_* statuses are terminal outcomes of the
 * SPEARHEAD_INVOKED gate.
 */
public enum CycleStatus {
    ACTIVE,
    BLOCKED_SCORE,
    BLOCKED_CONTEXT,
    BLOCKED_CAPITAL,
    BLOCKED_CAPACITY,
    BLOCKED_DUPLICATE_ASSET,
    EMERGENCY_EXIT,
    MANUAL_INTERVENTION,
    COMPLETED;

    public boolean isBlocked() {
        return switch (this) {
            case BLOCKED_SCORE, BLOCKED_CONTEXT, BLOCKED_CAPITAL,
                 BLOCKED_CAPACITY, BLOCKED_DUPLICATE_ASSET -> true;
            case ACTIVE, EMERGENCY_EXIT, MANUAL_INTERVENTION, COMPLETED -> false;
        };
    }

    public boolean isFinal() {
        return isBlocked() || this == COMPLETED;
    }
}
