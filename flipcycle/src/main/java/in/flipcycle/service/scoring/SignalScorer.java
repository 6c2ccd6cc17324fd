package in.flipcycle.service.scoring;

import in.flipcycle.config.ScoringConfig;
import in.flipcycle.domain.history.MemoryEcho;
import in.flipcycle.domain.signal.MarketContext;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.ScoreDecision;
import in.flipcycle.domain.signal.Signal;
import in.flipcycle.service.history.MemoryWeighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * GO/NO-GO decision on a signal.
 *
 * The breakdown comes from the configured ScoringStrategy; acceptance is
 * total >= rejectionThreshold. History never changes the decision. It only
 * feeds the context multiplier used when a running cycle is re-validated.
 */
public final class SignalScorer {
    private static final Logger log = LoggerFactory.getLogger(SignalScorer.class);

    private final ScoringStrategy strategy;
    private final ScoringConfig config;

    public SignalScorer(ScoringStrategy strategy, ScoringConfig config) {
        this.strategy = strategy;
        this.config = config;
    }

    /**
     * Score a signal. The history is the echo set MemoryWeighting selected for
     * this signal and is only logged here.
     */
    public ScoreDecision score(Signal signal, MarketContext context, List<MemoryEcho> history) {
        ScoreBreakdown breakdown = strategy.evaluate(signal, context);
        double threshold = config.rejectionThreshold();
        ScoreDecision decision = breakdown.total() >= threshold
            ? ScoreDecision.accept(breakdown, threshold)
            : ScoreDecision.reject(breakdown, threshold);

        log.info("Scored {} {}: total={} (q={} rr={} mc={} ps={} lt={}) history={} -> {}",
            signal.signalId(), signal.asset(),
            String.format("%.1f", breakdown.total()),
            fmt(breakdown.signalQuality()), fmt(breakdown.riskReward()), fmt(breakdown.marketConditions()),
            fmt(breakdown.positionSizing()), fmt(breakdown.longTermAlignment()),
            history != null ? history.size() : 0,
            decision.accepted() ? "GO" : "NO-GO");
        return decision;
    }

    /**
     * Live re-score of a running cycle's signal, adjusted by the cycle's
     * context multiplier.
     */
    public double rescore(Signal signal, MarketContext context, double contextMultiplier) {
        return adjust(strategy.reevaluate(signal, context).total(), contextMultiplier);
    }

    /**
     * clamp(total × (1 − band + 2·band·multiplier)). A multiplier of 0.5 is
     * neutral.
     */
    public double adjust(double total, double contextMultiplier) {
        double band = config.multiplierBand();
        double m = MemoryWeighting.clampUnit(contextMultiplier);
        double adjusted = total * (1.0 - band + 2.0 * band * m);
        return Math.max(0.0, Math.min(100.0, adjusted));
    }

    public double cognitiveExitThreshold() {
        return config.cognitiveExitThreshold();
    }

    private static String fmt(double v) {
        return String.format("%.0f", v);
    }
}
