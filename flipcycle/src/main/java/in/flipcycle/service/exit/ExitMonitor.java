package in.flipcycle.service.exit;

import in.flipcycle.config.ExitConfig;
import in.flipcycle.domain.cycle.ExitDecision;
import in.flipcycle.domain.cycle.FlipCycle;
import in.flipcycle.domain.cycle.TrailingStop;
import in.flipcycle.domain.ladder.LadderOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Evaluates exit conditions for a running cycle on every tick.
 *
 * Priority: HARD_STOP > COGNITIVE_EXIT > TRAILING_STOP > TAKE_PROFIT.
 * Price exits need at least one filled rung. The trailing stop is updated on
 * the cycle as a side effect; its stop price never moves down.
 */
public final class ExitMonitor {
    private static final Logger log = LoggerFactory.getLogger(ExitMonitor.class);

    private static final int PRICE_SCALE = 8;

    private final ExitConfig config;
    private final double cognitiveExitThreshold;

    public ExitMonitor(ExitConfig config, double cognitiveExitThreshold) {
        this.config = config;
        this.cognitiveExitThreshold = cognitiveExitThreshold;
    }

    /**
     * @param currentPrice latest price, or null when the feed failed this tick
     * @param currentScore adjusted live re-score of the cycle's signal
     */
    public ExitDecision evaluate(FlipCycle cycle, BigDecimal currentPrice, double currentScore) {
        LadderOrder ladder = cycle.ladder();
        boolean priceExits = currentPrice != null && ladder != null && ladder.hasFills();

        TrailingStop trailing = cycle.trailingStop();
        if (priceExits) {
            trailing = updateTrailing(trailing, ladder.avgEntry(), currentPrice);
            cycle.updateTrailingStop(trailing);
        }

        // 1. Hard stop
        if (priceExits && currentPrice.compareTo(ladder.hardStop()) <= 0) {
            log.warn("🛑 Hard stop hit: {} @ {} (stop {})", cycle.cycleId(), currentPrice, ladder.hardStop());
            return ExitDecision.HARD_STOP;
        }

        // 2. Cognitive exit
        if (currentScore < cognitiveExitThreshold) {
            log.warn("🧠 Cognitive exit: {} re-score {} < {}",
                cycle.cycleId(), String.format("%.1f", currentScore), cognitiveExitThreshold);
            return ExitDecision.COGNITIVE_EXIT;
        }

        if (!priceExits) {
            return ExitDecision.NONE;
        }

        // 3. Trailing stop
        if (trailing.active() && currentPrice.compareTo(trailing.stopPrice()) <= 0) {
            log.info("Trailing stop hit: {} @ {} (high {}, stop {})",
                cycle.cycleId(), currentPrice, trailing.highestPrice(), trailing.stopPrice());
            return ExitDecision.TRAILING_STOP;
        }

        // 4. Take profit
        if (currentPrice.compareTo(ladder.takeProfit()) >= 0) {
            log.info("🎯 Take profit hit: {} @ {} (target {})", cycle.cycleId(), currentPrice, ladder.takeProfit());
            return ExitDecision.TAKE_PROFIT;
        }

        return ExitDecision.NONE;
    }

    /**
     * Next trailing-stop state. Activates once the gain over avgEntry reaches
     * the activation percentage; afterwards the high and the stop only rise.
     */
    TrailingStop updateTrailing(TrailingStop current, BigDecimal avgEntry, BigDecimal price) {
        BigDecimal keep = BigDecimal.valueOf(1.0 - config.trailingFraction());
        if (!current.active()) {
            if (avgEntry == null || avgEntry.signum() <= 0) {
                return current;
            }
            double gain = price.subtract(avgEntry).divide(avgEntry, 10, RoundingMode.HALF_UP).doubleValue();
            if (gain < config.trailingActivationFraction()) {
                return current;
            }
            BigDecimal stop = price.multiply(keep).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
            log.info("✅ Trailing stop ACTIVATED @ {} (gain {}%, stop {})",
                price, String.format("%.2f", gain * 100), stop);
            return new TrailingStop(true, price, stop);
        }

        BigDecimal high = current.highestPrice().max(price);
        BigDecimal candidate = high.multiply(keep).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        BigDecimal stop = current.stopPrice().max(candidate);
        if (high.equals(current.highestPrice()) && stop.equals(current.stopPrice())) {
            return current;
        }
        return new TrailingStop(true, high, stop);
    }
}
