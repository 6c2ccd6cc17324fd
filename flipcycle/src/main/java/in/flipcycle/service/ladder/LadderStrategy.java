package in.flipcycle.service.ladder;

import in.flipcycle.domain.signal.Signal;

import java.math.BigDecimal;
import java.util.List;

/**
 * Decides ladder shape: how many tiers, where they sit and how capital is
 * split between them.
 */
public interface LadderStrategy {

    int tierCountFor(Signal signal);

    /**
     * Rung prices from low to high, one per tier.
     */
    List<BigDecimal> rungPrices(BigDecimal low, BigDecimal high, int tierCount);

    /**
     * Capital weights per tier, summing to 1.0.
     */
    List<Double> weights(int tierCount);
}
