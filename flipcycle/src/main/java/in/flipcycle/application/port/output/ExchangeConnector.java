package in.flipcycle.application.port.output;

import in.flipcycle.domain.order.OrderSide;
import in.flipcycle.domain.order.OrderStatus;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Exchange-connector collaborator.
 *
 * Every call may fail or succeed only partially; the core reconciles fills
 * through FillTracker and status polling rather than trusting a single
 * response.
 *
 * Error Handling:
 * - placement failures complete the future with OrderPlacementException
 * - cancelOrder completes with false (or OrderCancellationException) when the
 *   exchange did not confirm the cancellation
 */
public interface ExchangeConnector {

    /**
     * Place a resting limit order.
     *
     * @return future with the exchange order id
     */
    CompletableFuture<String> placeLimitOrder(String asset, OrderSide side, BigDecimal size, BigDecimal price);

    /**
     * Place a market order.
     *
     * @return future with the exchange order id
     */
    CompletableFuture<String> placeMarketOrder(String asset, OrderSide side, BigDecimal size);

    /**
     * Cancel an order. Cancelling an order that is already cancelled or
     * unknown to the exchange confirms with true.
     *
     * @return future with true when the exchange confirmed the cancellation
     */
    CompletableFuture<Boolean> cancelOrder(String orderId);

    /**
     * Poll the status of an order.
     */
    CompletableFuture<OrderStatus> getOrderStatus(String orderId);
}
