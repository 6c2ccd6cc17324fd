package in.flipcycle.domain.order;

/**
 * Order status as reported by the exchange connector.
 */
public enum OrderStatus {
    OPEN,       // Resting at the exchange
    PARTIAL,    // Partially filled, still resting
    FILLED,     // Completely filled
    REJECTED,   // Rejected by the exchange
    CANCELLED,  // Cancelled by user or system
    UNKNOWN     // Exchange does not know the order id
}
