package in.flipcycle.infrastructure.paper;

import in.flipcycle.application.port.output.ExchangeConnector;
import in.flipcycle.application.port.output.OrderCancellationException;
import in.flipcycle.application.port.output.OrderPlacementException;
import in.flipcycle.application.port.output.PriceFeed;
import in.flipcycle.application.port.output.PriceFeedException;
import in.flipcycle.domain.order.OrderSide;
import in.flipcycle.domain.order.OrderStatus;
import in.flipcycle.domain.order.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process exchange for paper trading and tests.
 *
 * Prices are set explicitly or moved by a random walk. Limit BUY orders fill
 * when the price is at or below the limit, limit SELL orders at or above it;
 * market orders fill at the current price. Failures can be injected per call
 * type to exercise retry and alert paths.
 */
public final class PaperExchange implements PriceFeed, ExchangeConnector {
    private static final Logger log = LoggerFactory.getLogger(PaperExchange.class);

    /**
     * One order as the paper exchange sees it.
     */
    public record PaperOrder(
        String orderId,
        String asset,
        OrderSide side,
        BigDecimal size,
        BigDecimal limitPrice,      // null for market orders
        OrderStatus status,
        BigDecimal fillPrice
    ) {
        PaperOrder withStatus(OrderStatus newStatus, BigDecimal price) {
            return new PaperOrder(orderId, asset, side, size, limitPrice, newStatus, price);
        }

        public boolean isOpen() {
            return status == OrderStatus.OPEN || status == OrderStatus.PARTIAL;
        }
    }

    private final Map<String, BigDecimal> prices = new HashMap<>();
    private final Map<String, Double> changes = new HashMap<>();
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private final AtomicLong orderSeq = new AtomicLong();
    private final Clock clock;

    private final AtomicInteger priceFailures = new AtomicInteger();
    private final AtomicInteger placementFailures = new AtomicInteger();
    private final AtomicInteger cancelFailures = new AtomicInteger();
    private volatile double priceFailureRate = 0.0;
    private volatile double cancelFailureRate = 0.0;
    private final Random random;

    public PaperExchange(Clock clock) {
        this(clock, new Random());
    }

    public PaperExchange(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    // ═══════════════════════════════════════════════════════════════
    // Market simulation
    // ═══════════════════════════════════════════════════════════════

    public synchronized void setPrice(String asset, BigDecimal price) {
        setPrice(asset, price, changes.getOrDefault(asset, 0.0));
    }

    public synchronized void setPrice(String asset, BigDecimal price, double change24hPct) {
        prices.put(asset, price);
        changes.put(asset, change24hPct);
        matchOrders(asset, price);
    }

    public synchronized BigDecimal currentPrice(String asset) {
        return prices.get(asset);
    }

    /**
     * Move every known price by a normal step of the given relative volatility.
     */
    public synchronized void randomWalk(double volatility) {
        for (String asset : List.copyOf(prices.keySet())) {
            BigDecimal price = prices.get(asset);
            double factor = Math.max(0.5, 1.0 + random.nextGaussian() * volatility);
            BigDecimal next = price.multiply(BigDecimal.valueOf(factor)).setScale(8, RoundingMode.HALF_UP);
            setPrice(asset, next);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Failure injection
    // ═══════════════════════════════════════════════════════════════

    public void failNextPriceQuotes(int count) {
        priceFailures.set(count);
    }

    public void failNextPlacements(int count) {
        placementFailures.set(count);
    }

    public void failNextCancels(int count) {
        cancelFailures.set(count);
    }

    /**
     * Random failure rates for price quotes and cancellations, 0..1.
     */
    public void setFailureRates(double priceFailureRate, double cancelFailureRate) {
        this.priceFailureRate = priceFailureRate;
        this.cancelFailureRate = cancelFailureRate;
    }

    // ═══════════════════════════════════════════════════════════════
    // PriceFeed
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<PriceQuote> getPrice(String asset) {
        if (consume(priceFailures) || roll(priceFailureRate)) {
            return CompletableFuture.failedFuture(new PriceFeedException(asset, "injected feed failure"));
        }
        synchronized (this) {
            BigDecimal price = prices.get(asset);
            if (price == null) {
                return CompletableFuture.failedFuture(new PriceFeedException(asset, "no market"));
            }
            return CompletableFuture.completedFuture(
                new PriceQuote(asset, price, changes.getOrDefault(asset, 0.0), clock.instant()));
        }
    }

    @Override
    public synchronized CompletableFuture<Map<String, BigDecimal>> getPrices(List<String> assets) {
        Map<String, BigDecimal> result = new HashMap<>();
        for (String asset : assets) {
            BigDecimal price = prices.get(asset);
            if (price != null) {
                result.put(asset, price);
            }
        }
        return CompletableFuture.completedFuture(result);
    }

    // ═══════════════════════════════════════════════════════════════
    // ExchangeConnector
    // ═══════════════════════════════════════════════════════════════

    @Override
    public synchronized CompletableFuture<String> placeLimitOrder(String asset, OrderSide side, BigDecimal size, BigDecimal price) {
        if (consume(placementFailures)) {
            return CompletableFuture.failedFuture(
                new OrderPlacementException(asset, side, size, "injected placement failure"));
        }
        String orderId = nextOrderId();
        orders.put(orderId, new PaperOrder(orderId, asset, side, size, price, OrderStatus.OPEN, null));
        log.debug("[PAPER] Limit {} {} {} @ {} -> {}", side, size, asset, price, orderId);
        BigDecimal market = prices.get(asset);
        if (market != null) {
            matchOrders(asset, market);
        }
        return CompletableFuture.completedFuture(orderId);
    }

    @Override
    public synchronized CompletableFuture<String> placeMarketOrder(String asset, OrderSide side, BigDecimal size) {
        if (consume(placementFailures)) {
            return CompletableFuture.failedFuture(
                new OrderPlacementException(asset, side, size, "injected placement failure"));
        }
        BigDecimal market = prices.get(asset);
        if (market == null) {
            return CompletableFuture.failedFuture(new OrderPlacementException(asset, side, size, "no market"));
        }
        String orderId = nextOrderId();
        orders.put(orderId, new PaperOrder(orderId, asset, side, size, null, OrderStatus.FILLED, market));
        log.debug("[PAPER] Market {} {} {} filled @ {} -> {}", side, size, asset, market, orderId);
        return CompletableFuture.completedFuture(orderId);
    }

    @Override
    public synchronized CompletableFuture<Boolean> cancelOrder(String orderId) {
        if (consume(cancelFailures) || roll(cancelFailureRate)) {
            return CompletableFuture.failedFuture(new OrderCancellationException(orderId, "injected cancel failure"));
        }
        PaperOrder order = orders.get(orderId);
        if (order == null || order.status() == OrderStatus.CANCELLED) {
            return CompletableFuture.completedFuture(true);
        }
        if (!order.isOpen()) {
            return CompletableFuture.completedFuture(false);
        }
        orders.put(orderId, order.withStatus(OrderStatus.CANCELLED, null));
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public synchronized CompletableFuture<OrderStatus> getOrderStatus(String orderId) {
        PaperOrder order = orders.get(orderId);
        return CompletableFuture.completedFuture(order != null ? order.status() : OrderStatus.UNKNOWN);
    }

    // ═══════════════════════════════════════════════════════════════
    // Inspection
    // ═══════════════════════════════════════════════════════════════

    public synchronized List<PaperOrder> orders() {
        return List.copyOf(orders.values());
    }

    public synchronized List<PaperOrder> openOrders(String asset) {
        return orders.values().stream()
            .filter(PaperOrder::isOpen)
            .filter(o -> o.asset().equals(asset))
            .toList();
    }

    // Must hold the monitor
    private void matchOrders(String asset, BigDecimal price) {
        for (PaperOrder order : List.copyOf(orders.values())) {
            if (!order.isOpen() || !order.asset().equals(asset) || order.limitPrice() == null) {
                continue;
            }
            boolean marketable = order.side() == OrderSide.BUY
                ? price.compareTo(order.limitPrice()) <= 0
                : price.compareTo(order.limitPrice()) >= 0;
            if (marketable) {
                orders.put(order.orderId(), order.withStatus(OrderStatus.FILLED, order.limitPrice()));
                log.debug("[PAPER] {} filled @ {}", order.orderId(), order.limitPrice());
            }
        }
    }

    private String nextOrderId() {
        return "PAPER-" + orderSeq.incrementAndGet();
    }

    private static boolean consume(AtomicInteger counter) {
        return counter.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    private boolean roll(double rate) {
        if (rate <= 0) {
            return false;
        }
        synchronized (random) {
            return random.nextDouble() < rate;
        }
    }
}
