package in.flipcycle.domain.order;

public enum OrderSide {
    BUY,
    SELL
}
