package in.flipcycle.application.port.output;

/**
 * Exception thrown when order cancellation fails.
 */
public class OrderCancellationException extends RuntimeException {

    private final String orderId;

    public OrderCancellationException(String orderId, String message) {
        super(String.format("Order cancellation failed for %s: %s", orderId, message));
        this.orderId = orderId;
    }

    public OrderCancellationException(String orderId, String message, Throwable cause) {
        super(String.format("Order cancellation failed for %s: %s", orderId, message), cause);
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
