package in.flipcycle.domain.cycle;

/**
 * Output of one ExitMonitor evaluation, in priority order (highest first,
 * NONE last).
 */
public enum ExitDecision {
    HARD_STOP,
    COGNITIVE_EXIT,
    TRAILING_STOP,
    TAKE_PROFIT,
    NONE;

    public boolean isExit() {
        return this != NONE;
    }

    public ExitReason toReason() {
        return switch (this) {
            case HARD_STOP -> ExitReason.HARD_STOP;
            case COGNITIVE_EXIT -> ExitReason.COGNITIVE_EXIT;
            case TRAILING_STOP -> ExitReason.TRAILING_STOP;
            case TAKE_PROFIT -> ExitReason.TAKE_PROFIT;
            case NONE -> throw new IllegalStateException("NONE is not an exit");
        };
    }
}
