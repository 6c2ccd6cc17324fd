package in.flipcycle.domain.monitoring;

/**
 * Alert priority levels for the alert collaborator.
 */
public enum AlertLevel {
    /**
     * CRITICAL - Operator action required.
     * Examples: cycle flagged for manual intervention
     */
    CRITICAL,

    /**
     * HIGH - Capital-protecting event.
     * Examples: emergency exit, hard stop
     */
    HIGH,

    /**
     * MEDIUM - Degraded operation.
     * Examples: price feed failing, rung order rejected
     */
    MEDIUM,

    /**
     * INFO - Routine lifecycle events.
     * Examples: take profit, reserve transfer
     */
    INFO
}
