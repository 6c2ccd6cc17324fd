package in.flipcycle.service.ladder;

import in.flipcycle.config.LadderConfig;
import in.flipcycle.domain.signal.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Rungs spaced on a power curve across the entry band, front-loaded weights.
 *
 * price(i) = low + (high - low) * (i / (n - 1))^curve
 */
public final class CurvedLadderStrategy implements LadderStrategy {

    static final int PRICE_SCALE = 8;

    private final LadderConfig config;

    public CurvedLadderStrategy(LadderConfig config) {
        this.config = config;
    }

    /**
     * Confidence &lt; 0.70 → 3, &lt; 0.80 → 4, &lt; 0.90 → 5, else 6; bounded
     * to the configured range.
     */
    @Override
    public int tierCountFor(Signal signal) {
        double confidence = signal.confidence();
        int tiers;
        if (confidence < 0.70) {
            tiers = 3;
        } else if (confidence < 0.80) {
            tiers = 4;
        } else if (confidence < 0.90) {
            tiers = 5;
        } else {
            tiers = 6;
        }
        return Math.max(config.minTiers(), Math.min(config.maxTiers(), tiers));
    }

    @Override
    public List<BigDecimal> rungPrices(BigDecimal low, BigDecimal high, int tierCount) {
        List<BigDecimal> prices = new ArrayList<>(tierCount);
        if (tierCount == 1) {
            prices.add(low.setScale(PRICE_SCALE, RoundingMode.HALF_UP));
            return prices;
        }
        BigDecimal span = high.subtract(low);
        for (int i = 0; i < tierCount; i++) {
            double position = Math.pow((double) i / (tierCount - 1), config.curve());
            BigDecimal price = low.add(span.multiply(BigDecimal.valueOf(position)));
            prices.add(price.setScale(PRICE_SCALE, RoundingMode.HALF_UP));
        }
        return prices;
    }

    @Override
    public List<Double> weights(int tierCount) {
        List<Double> base = config.tierWeights();
        if (tierCount > base.size()) {
            throw new IllegalArgumentException("At most " + base.size() + " tiers supported, got " + tierCount);
        }
        List<Double> truncated = base.subList(0, tierCount);
        double sum = truncated.stream().mapToDouble(Double::doubleValue).sum();
        List<Double> normalized = new ArrayList<>(tierCount);
        for (Double w : truncated) {
            normalized.add(w / sum);
        }
        return normalized;
    }
}
