package in.flipcycle.service.scoring;

import in.flipcycle.config.ScoringConfig;
import in.flipcycle.domain.signal.Direction;
import in.flipcycle.domain.signal.MarketContext;
import in.flipcycle.domain.signal.ScoreBreakdown;
import in.flipcycle.domain.signal.Signal;

import java.math.BigDecimal;

/**
 * Five-factor weighted scoring.
 *
 * Factors (each 0-100):
 * - signal quality: field completeness plus source confidence
 * - risk/reward: (target - entry) / (entry - stop), stepped
 * - market conditions: asset tier, size of the proposed move, 24h calm
 * - position sizing: capital as a share of the reference account
 * - long-term alignment: hold/active asset class and expected return
 *
 * The weighted total is clamped to 0-100 by ScoreBreakdown.
 */
public final class RayScoringStrategy implements ScoringStrategy {

    private final ScoringConfig config;

    public RayScoringStrategy(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public ScoreBreakdown evaluate(Signal signal, MarketContext context) {
        return score(signal, context, toDouble(signal.entryMidpoint()));
    }

    @Override
    public ScoreBreakdown reevaluate(Signal signal, MarketContext context) {
        double entry = context != null && context.hasPrice()
            ? context.price().doubleValue()
            : toDouble(signal.entryMidpoint());
        return score(signal, context, entry);
    }

    private ScoreBreakdown score(Signal signal, MarketContext context, double entry) {
        return ScoreBreakdown.of(
            signalQuality(signal),
            riskReward(entry, toDouble(signal.targetPrice()), toDouble(signal.stopPrice())),
            marketConditions(signal, context),
            positionSizing(signal),
            longTermAlignment(signal, entry),
            config.weights()
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // Factors
    // ═══════════════════════════════════════════════════════════════

    double signalQuality(Signal signal) {
        double score = 0.0;
        if (signal.asset() != null && !signal.asset().isBlank()) score += 12;
        if (signal.entryLow() != null && signal.entryHigh() != null) score += 12;
        if (signal.targetPrice() != null) score += 12;
        if (signal.stopPrice() != null) score += 12;
        if (signal.capital() != null && signal.capital().signum() > 0) score += 12;
        score += clampUnit(signal.confidence()) * 40;
        return score;
    }

    /**
     * Stepped risk/reward score. Monotonic non-decreasing in the ratio.
     */
    static double riskReward(double entry, double target, double stop) {
        if (Double.isNaN(entry) || Double.isNaN(target) || Double.isNaN(stop)) {
            return 0.0;
        }
        double risk = entry - stop;
        if (risk <= 0) {
            return 0.0;
        }
        return riskRewardScore((target - entry) / risk);
    }

    static double riskRewardScore(double ratio) {
        if (ratio >= 4.0) return 100;
        if (ratio >= 3.0) return 90;
        if (ratio >= 2.5) return 80;
        if (ratio >= 2.0) return 70;
        if (ratio >= 1.5) return 55;
        if (ratio >= 1.0) return 40;
        return 20;
    }

    double marketConditions(Signal signal, MarketContext context) {
        double score;
        if (config.isMajor(signal.asset())) {
            score = 40;
        } else if (config.isMid(signal.asset())) {
            score = 25;
        } else {
            score = 10;
        }

        double reference = context != null && context.hasPrice()
            ? context.price().doubleValue()
            : toDouble(signal.entryMidpoint());
        double target = toDouble(signal.targetPrice());
        if (reference > 0 && !Double.isNaN(target)) {
            double movePct = (target - reference) / reference * 100.0;
            if (movePct >= 5 && movePct <= 25) {
                score += 40;
            } else if ((movePct >= 2 && movePct < 5) || (movePct > 25 && movePct <= 40)) {
                score += 20;
            } else if (movePct > 40) {
                score -= 20;
            }
        }

        if (context != null && Math.abs(context.change24hPct()) <= 10.0) {
            score += 20;
        }
        return score;
    }

    double positionSizing(Signal signal) {
        if (signal.capital() == null || signal.capital().signum() <= 0) {
            return 0.0;
        }
        double pct = signal.capital().doubleValue() / config.referenceAccount().doubleValue() * 100.0;
        if (pct >= 2 && pct <= 5) return 100;
        if ((pct >= 0.5 && pct < 2) || (pct > 5 && pct <= 8)) return 75;
        if (pct > 8 && pct <= 12) return 50;
        return 20;
    }

    double longTermAlignment(Signal signal, double entry) {
        double score = 40;
        if (config.isHold(signal.asset()) && signal.direction() == Direction.BUY) {
            score += 35;
        } else if (config.isActive(signal.asset())) {
            score += 25;
        } else {
            score += 5;
        }

        double target = toDouble(signal.targetPrice());
        if (entry > 0 && !Double.isNaN(target)) {
            double expectedPct = (target - entry) / entry * 100.0;
            // 50-100% earns nothing
            if (expectedPct > 100) {
                score -= 30;
            } else if (expectedPct >= 10 && expectedPct <= 50) {
                score += 25;
            } else if (expectedPct < 10) {
                score += 10;
            }
        }
        return score;
    }

    private static double toDouble(BigDecimal value) {
        return value != null ? value.doubleValue() : Double.NaN;
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
