package in.flipcycle.application.port.output;

import in.flipcycle.domain.order.OrderSide;

import java.math.BigDecimal;

/**
 * Exception thrown when the exchange rejects an order.
 */
public class OrderPlacementException extends RuntimeException {

    private final String asset;
    private final OrderSide side;
    private final BigDecimal size;

    public OrderPlacementException(String asset, OrderSide side, BigDecimal size, String message) {
        super(String.format("Order placement failed for %s %s %s: %s", side, size, asset, message));
        this.asset = asset;
        this.side = side;
        this.size = size;
    }

    public OrderPlacementException(String asset, OrderSide side, BigDecimal size, String message, Throwable cause) {
        super(String.format("Order placement failed for %s %s %s: %s", side, size, asset, message), cause);
        this.asset = asset;
        this.side = side;
        this.size = size;
    }

    public String getAsset() {
        return asset;
    }

    public OrderSide getSide() {
        return side;
    }

    public BigDecimal getSize() {
        return size;
    }
}
