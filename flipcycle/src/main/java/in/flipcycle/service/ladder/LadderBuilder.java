package in.flipcycle.service.ladder;

import in.flipcycle.config.ExitConfig;
import in.flipcycle.config.LadderConfig;
import in.flipcycle.domain.ladder.LadderOrder;
import in.flipcycle.domain.ladder.LadderRung;
import in.flipcycle.domain.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an approved signal into a priced, sized entry ladder.
 *
 * When the signal asks for immediate execution, rung 0 is returned already
 * FILLED at the market price and the ladder's fill totals include it.
 */
public final class LadderBuilder {
    private static final Logger log = LoggerFactory.getLogger(LadderBuilder.class);

    private static final int MONEY_SCALE = 8;

    private final LadderStrategy strategy;
    private final LadderConfig ladderConfig;
    private final ExitConfig exitConfig;

    public LadderBuilder(LadderStrategy strategy, LadderConfig ladderConfig, ExitConfig exitConfig) {
        this.strategy = strategy;
        this.ladderConfig = ladderConfig;
        this.exitConfig = exitConfig;
    }

    public int tierCountFor(Signal signal) {
        return strategy.tierCountFor(signal);
    }

    /**
     * Build with the strategy's tier count.
     */
    public LadderOrder build(Signal signal, BigDecimal marketPrice, Instant now) {
        return build(signal, strategy.tierCountFor(signal), marketPrice, now);
    }

    /**
     * @param marketPrice used for the pre-filled rung; may be null when the
     *                    signal does not request immediate execution
     * @throws LadderConstructionException if the band is empty, tierCount &lt; 1
     *                                     or capital is not positive
     */
    public LadderOrder build(Signal signal, int tierCount, BigDecimal marketPrice, Instant now) {
        String asset = signal.asset();
        BigDecimal low = signal.entryLow();
        BigDecimal high = signal.entryHigh();
        BigDecimal capital = signal.capital();

        if (low == null || high == null || high.compareTo(low) <= 0) {
            throw new LadderConstructionException(asset,
                String.format("entry band high %s must be above low %s", high, low));
        }
        if (tierCount < 1) {
            throw new LadderConstructionException(asset, "tierCount must be >= 1, got " + tierCount);
        }
        if (capital == null || capital.signum() <= 0) {
            throw new LadderConstructionException(asset, "capital must be > 0, got " + capital);
        }
        boolean prefill = signal.immediateExecution();
        if (prefill && (marketPrice == null || marketPrice.signum() <= 0)) {
            throw new LadderConstructionException(asset, "immediate execution needs a market price");
        }

        List<BigDecimal> prices = strategy.rungPrices(low, high, tierCount);
        List<Double> weights;
        try {
            weights = strategy.weights(tierCount);
        } catch (IllegalArgumentException e) {
            throw new LadderConstructionException(asset, e.getMessage());
        }

        List<LadderRung> rungs = new ArrayList<>(tierCount);
        for (int i = 0; i < tierCount; i++) {
            BigDecimal price = (i == 0 && prefill) ? marketPrice : prices.get(i);
            double weight = weights.get(i);
            BigDecimal allocated = capital.multiply(BigDecimal.valueOf(weight))
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
            BigDecimal size = allocated.divide(price, ladderConfig.sizeScale(), RoundingMode.HALF_DOWN);
            rungs.add(LadderRung.pending(i, price, size, allocated, weight));
        }

        BigDecimal lowest = rungs.stream().map(LadderRung::price).min(BigDecimal::compareTo).orElseThrow();
        BigDecimal highest = rungs.stream().map(LadderRung::price).max(BigDecimal::compareTo).orElseThrow();
        BigDecimal hardStop = lowest.multiply(BigDecimal.valueOf(1.0 - exitConfig.hardStopFraction()))
            .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal takeProfit = highest.multiply(BigDecimal.valueOf(1.0 + exitConfig.takeProfitFraction()))
            .setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        LadderOrder ladder = LadderOrder.unfilled(asset, rungs, capital, hardStop, takeProfit);
        if (prefill) {
            LadderRung first = rungs.get(0);
            BigDecimal value = first.value();
            ladder = new LadderOrder(asset, replaceFirst(rungs, first.filled(now)), capital,
                first.price(), first.size(), value, hardStop, takeProfit);
        }

        log.info("Built {}-tier ladder for {}: band [{} .. {}], capital {}, hardStop {}, takeProfit {}{}",
            tierCount, asset, low, high, capital, hardStop, takeProfit,
            prefill ? ", rung 0 pre-filled @ " + marketPrice : "");
        return ladder;
    }

    private static List<LadderRung> replaceFirst(List<LadderRung> rungs, LadderRung first) {
        List<LadderRung> copy = new ArrayList<>(rungs);
        copy.set(0, first);
        return copy;
    }
}
