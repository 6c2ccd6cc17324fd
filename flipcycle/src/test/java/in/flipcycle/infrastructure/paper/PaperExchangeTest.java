package in.flipcycle.infrastructure.paper;

import in.flipcycle.application.port.output.OrderPlacementException;
import in.flipcycle.application.port.output.PriceFeedException;
import in.flipcycle.domain.order.OrderSide;
import in.flipcycle.domain.order.OrderStatus;
import in.flipcycle.domain.order.PriceQuote;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class PaperExchangeTest {

    private static final String BTC = "BTC/USDT";

    private PaperExchange exchange;

    @BeforeEach
    void setUp() {
        exchange = new PaperExchange(Clock.fixed(TestSignals.T0, ZoneOffset.UTC), new Random(42));
        exchange.setPrice(BTC, new BigDecimal("100"), 1.5);
    }

    @Test
    void testQuote() throws Exception {
        PriceQuote quote = exchange.getPrice(BTC).get();

        assertEquals(new BigDecimal("100"), quote.price());
        assertEquals(1.5, quote.change24hPct(), 1e-9);
        assertEquals(TestSignals.T0, quote.timestamp());
        assertEquals(Map.of(BTC, new BigDecimal("100")), exchange.getPrices(List.of(BTC, "ETH/USDT")).get());
    }

    @Test
    void testUnknownAssetHasNoQuote() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> exchange.getPrice("ETH/USDT").get());
        assertInstanceOf(PriceFeedException.class, e.getCause());
    }

    @Test
    void testLimitBuyFillsWhenPriceReachesIt() throws Exception {
        String orderId = exchange.placeLimitOrder(BTC, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("98")).get();
        assertEquals(OrderStatus.OPEN, exchange.getOrderStatus(orderId).get());
        assertEquals(1, exchange.openOrders(BTC).size());

        exchange.setPrice(BTC, new BigDecimal("97.5"));

        assertEquals(OrderStatus.FILLED, exchange.getOrderStatus(orderId).get());
        assertEquals(new BigDecimal("98"), exchange.orders().get(0).fillPrice(), "Fills at the limit");
        assertTrue(exchange.openOrders(BTC).isEmpty());
    }

    @Test
    void testMarketableLimitFillsOnPlacement() throws Exception {
        String orderId = exchange.placeLimitOrder(BTC, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("101")).get();

        assertEquals(OrderStatus.FILLED, exchange.getOrderStatus(orderId).get());
    }

    @Test
    void testLimitSellFillsAtOrAbove() throws Exception {
        String orderId = exchange.placeLimitOrder(BTC, OrderSide.SELL, BigDecimal.ONE, new BigDecimal("110")).get();
        exchange.setPrice(BTC, new BigDecimal("109.99"));
        assertEquals(OrderStatus.OPEN, exchange.getOrderStatus(orderId).get());

        exchange.setPrice(BTC, new BigDecimal("110"));
        assertEquals(OrderStatus.FILLED, exchange.getOrderStatus(orderId).get());
    }

    @Test
    void testMarketOrderNeedsAMarket() throws Exception {
        String orderId = exchange.placeMarketOrder(BTC, OrderSide.SELL, BigDecimal.ONE).get();
        assertEquals(OrderStatus.FILLED, exchange.getOrderStatus(orderId).get());

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> exchange.placeMarketOrder("ETH/USDT", OrderSide.BUY, BigDecimal.ONE).get());
        assertInstanceOf(OrderPlacementException.class, e.getCause());
    }

    @Test
    void testCancelSemantics() throws Exception {
        String open = exchange.placeLimitOrder(BTC, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("90")).get();
        String filled = exchange.placeMarketOrder(BTC, OrderSide.BUY, BigDecimal.ONE).get();

        assertTrue(exchange.cancelOrder(open).get());
        assertEquals(OrderStatus.CANCELLED, exchange.getOrderStatus(open).get());
        assertTrue(exchange.cancelOrder(open).get(), "Cancelling twice confirms");
        assertTrue(exchange.cancelOrder("PAPER-999").get(), "Unknown orders confirm");
        assertFalse(exchange.cancelOrder(filled).get(), "A filled order cannot be cancelled");
        assertEquals(OrderStatus.UNKNOWN, exchange.getOrderStatus("PAPER-999").get());
    }

    @Test
    void testInjectedFailures() throws Exception {
        exchange.failNextPriceQuotes(1);
        exchange.failNextPlacements(1);
        exchange.failNextCancels(1);

        assertThrows(ExecutionException.class, () -> exchange.getPrice(BTC).get());
        assertNotNull(exchange.getPrice(BTC).get());

        assertThrows(ExecutionException.class,
            () -> exchange.placeLimitOrder(BTC, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("90")).get());
        String orderId = exchange.placeLimitOrder(BTC, OrderSide.BUY, BigDecimal.ONE, new BigDecimal("90")).get();

        assertThrows(ExecutionException.class, () -> exchange.cancelOrder(orderId).get());
        assertTrue(exchange.cancelOrder(orderId).get());
    }

    @Test
    void testRandomWalkMovesPrices() {
        exchange.randomWalk(0.01);

        BigDecimal moved = exchange.currentPrice(BTC);
        assertNotEquals(0, moved.compareTo(new BigDecimal("100")));
        assertTrue(moved.signum() > 0);
    }
}
