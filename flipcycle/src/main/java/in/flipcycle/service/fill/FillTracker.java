package in.flipcycle.service.fill;

import in.flipcycle.application.port.output.ExchangeConnector;
import in.flipcycle.domain.ladder.FillEvent;
import in.flipcycle.domain.ladder.LadderOrder;
import in.flipcycle.domain.ladder.LadderRung;
import in.flipcycle.domain.order.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maintains rung fill state and the running weighted-average entry.
 *
 * Stateless with respect to ladders: every call takes a ladder value and
 * returns the next one. avgEntry = filledValue / filledSize where both totals
 * are exact running sums, so the incremental result always equals a batch
 * recomputation over the filled rungs.
 */
public final class FillTracker {
    private static final Logger log = LoggerFactory.getLogger(FillTracker.class);

    public static final int AVG_SCALE = 8;

    private final List<FillListener> listeners = new CopyOnWriteArrayList<>();
    private final Duration statusTimeout;

    public FillTracker(Duration statusTimeout) {
        this.statusTimeout = statusTimeout;
    }

    public void addListener(FillListener listener) {
        listeners.add(listener);
    }

    /**
     * Mark a rung filled at its own price. Re-filling a filled rung returns
     * the ladder unchanged and emits nothing.
     *
     * @throws IllegalStateException if the rung failed or was cancelled
     */
    public LadderOrder onFill(LadderOrder ladder, int rungIndex, Instant fillTime) {
        LadderRung rung = ladder.rung(rungIndex);
        if (rung.isFilled()) {
            log.debug("Rung {} of {} already filled, ignoring", rungIndex, ladder.asset());
            return ladder;
        }
        if (!rung.isOpen()) {
            throw new IllegalStateException(String.format(
                "Rung %d of %s is %s and cannot fill", rungIndex, ladder.asset(), rung.status()));
        }

        BigDecimal filledValue = ladder.filledValue().add(rung.value());
        BigDecimal filledSize = ladder.filledSize().add(rung.size());
        BigDecimal avgEntry = average(filledValue, filledSize);

        LadderOrder base = ladder.withRung(rungIndex, rung.filled(fillTime));
        LadderOrder next = new LadderOrder(base.asset(), base.rungs(), base.totalCapital(),
            avgEntry, filledSize, filledValue, base.hardStop(), base.takeProfit());

        log.info("✅ Rung {} filled: {} {} @ {} (avg entry {}, filled {})",
            rungIndex, ladder.asset(), rung.size(), rung.price(), avgEntry, filledSize);
        emit(new FillEvent(ladder.asset(), rungIndex, rung.price(), rung.size(), avgEntry, filledSize, fillTime));
        return next;
    }

    /**
     * Rungs the current price has reached: open and currentPrice ≤ rung price.
     */
    public List<LadderRung> onPriceTick(LadderOrder ladder, BigDecimal currentPrice) {
        return ladder.rungs().stream()
            .filter(LadderRung::isOpen)
            .filter(r -> currentPrice.compareTo(r.price()) <= 0)
            .toList();
    }

    /**
     * Bring the ladder in line with the market and the exchange.
     *
     * Rungs with a working order fill only when the exchange reports FILLED,
     * and are marked failed/cancelled when the exchange says so. Open rungs
     * without an order id fill when the price reaches them.
     */
    public LadderOrder reconcile(LadderOrder ladder, BigDecimal currentPrice, ExchangeConnector exchange, Instant now) {
        LadderOrder current = ladder;
        for (LadderRung rung : ladder.rungs()) {
            if (!rung.isOpen()) {
                continue;
            }
            if (!rung.hasWorkingOrder()) {
                if (currentPrice != null && currentPrice.compareTo(rung.price()) <= 0) {
                    current = onFill(current, rung.tier(), now);
                }
                continue;
            }

            OrderStatus status = fetchStatus(exchange, rung.orderId());
            switch (status) {
                case FILLED -> current = onFill(current, rung.tier(), now);
                case REJECTED -> {
                    log.warn("Rung {} order {} rejected by exchange", rung.tier(), rung.orderId());
                    current = current.withRung(rung.tier(), rung.failed());
                }
                case CANCELLED -> {
                    log.warn("Rung {} order {} cancelled at exchange", rung.tier(), rung.orderId());
                    current = current.withRung(rung.tier(), rung.cancelled());
                }
                case OPEN, PARTIAL, UNKNOWN -> {
                    // still working
                }
            }
        }
        return current;
    }

    /**
     * Batch average over filled rungs. Zero with no fills.
     */
    public static BigDecimal batchAverage(LadderOrder ladder) {
        BigDecimal value = BigDecimal.ZERO;
        BigDecimal size = BigDecimal.ZERO;
        for (LadderRung rung : ladder.rungs()) {
            if (rung.isFilled()) {
                value = value.add(rung.value());
                size = size.add(rung.size());
            }
        }
        return average(value, size);
    }

    static BigDecimal average(BigDecimal value, BigDecimal size) {
        if (size.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return value.divide(size, AVG_SCALE, RoundingMode.HALF_UP);
    }

    private OrderStatus fetchStatus(ExchangeConnector exchange, String orderId) {
        try {
            OrderStatus status = exchange.getOrderStatus(orderId)
                .get(statusTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return status != null ? status : OrderStatus.UNKNOWN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OrderStatus.UNKNOWN;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Order status unavailable for {}: {}", orderId, e.getMessage());
            return OrderStatus.UNKNOWN;
        }
    }

    private void emit(FillEvent event) {
        for (FillListener listener : listeners) {
            try {
                listener.onFill(event);
            } catch (RuntimeException e) {
                log.error("Fill listener failed for {} rung {}: {}", event.asset(), event.tier(), e.getMessage(), e);
            }
        }
    }
}
