package in.flipcycle.domain.cycle;

/**
 * The nine phases of a flip cycle.
 *
 * Forward-only, except that ASHEN_FLAME (emergency exit) can be entered from
 * LADDER_DEPLOYED or CRYSTAL_SCAN and then skips WINDMARK.
 */
public enum FlipPhase {
    SIGNAL_RECEIVED(1),
    MEMORY_WEIGHTING(2),
    SPEARHEAD_INVOKED(3),
    LADDER_DEPLOYED(4),
    CRYSTAL_SCAN(5),
    ASHEN_FLAME(6),
    WINDMARK(7),
    GLYPH_LOCK(8),
    ECHO_IMPRINT(9);

    private final int number;

    FlipPhase(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public boolean canTransitionTo(FlipPhase next) {
        return switch (this) {
            case SIGNAL_RECEIVED -> next == MEMORY_WEIGHTING;
            case MEMORY_WEIGHTING -> next == SPEARHEAD_INVOKED;
            case SPEARHEAD_INVOKED -> next == LADDER_DEPLOYED;
            case LADDER_DEPLOYED -> next == CRYSTAL_SCAN || next == ASHEN_FLAME || next == WINDMARK;
            case CRYSTAL_SCAN -> next == ASHEN_FLAME || next == WINDMARK;
            case ASHEN_FLAME, WINDMARK -> next == GLYPH_LOCK;
            case GLYPH_LOCK -> next == ECHO_IMPRINT;
            case ECHO_IMPRINT -> false;
        };
    }

    /**
     * Phases during which the cycle holds (or is acquiring) a position and is
     * watched by the runner.
     */
    public boolean isMonitored() {
        return switch (this) {
            case LADDER_DEPLOYED, CRYSTAL_SCAN -> true;
            case SIGNAL_RECEIVED, MEMORY_WEIGHTING, SPEARHEAD_INVOKED,
                 ASHEN_FLAME, WINDMARK, GLYPH_LOCK, ECHO_IMPRINT -> false;
        };
    }
}
