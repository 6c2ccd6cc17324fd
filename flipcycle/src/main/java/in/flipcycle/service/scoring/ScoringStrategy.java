package in.flipcycle.service.scoring;

import in.flipcycle.domain.signal.MarketContext;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.Signal;

/**
 * Produces a bounded score breakdown for a signal.
 */
public interface ScoringStrategy {

    /**
     * Score a freshly received signal.
     */
    ScoreBreakdown evaluate(Signal signal, MarketContext context);

    /**
     * Re-score a signal while its cycle is running. The live price replaces
     * the entry band where the strategy uses one.
     */
    default ScoreBreakdown reevaluate(Signal signal, MarketContext context) {
        return evaluate(signal, context);
    }
}
