package in.flipcycle.domain.cycle;

/**
 * Why a cycle left the market.
 */
public enum ExitReason {
    HARD_STOP,          // Price hit the ladder hard stop
    TRAILING_STOP,      // Trailing stop triggered
    TAKE_PROFIT,        // Price reached take profit
    COGNITIVE_EXIT,     // Re-score fell below the cognitive threshold
    OVEREXPOSURE,       // Crystal scan found the system overexposed
    RISK_SIGNAL,        // External risk signal above threshold at crystal scan
    LADDER_DECAYED,     // Decay timer expired with nothing filled
    LADDER_FAILED,      // No rung order could be placed
    MANUAL;             // Operator resolved a manual-intervention cycle

    /**
     * Exits that route through ASHEN_FLAME instead of WINDMARK.
     */
    public boolean isEmergency() {
        return this == COGNITIVE_EXIT || this == OVEREXPOSURE || this == RISK_SIGNAL;
    }
}
