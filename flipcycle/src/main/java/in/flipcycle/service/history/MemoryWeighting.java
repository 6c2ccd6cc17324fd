package in.flipcycle.service.history;

import in.flipcycle.domain.history.MemoryEcho;
import in.flipcycle.domain.signal.Signal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Derives weighting factors for new signals from past outcomes.
 */
public final class MemoryWeighting {

    public static final double NEUTRAL = 0.5;

    private final HistoryStore store;
    private final Duration lookback;

    public MemoryWeighting(HistoryStore store, Duration lookback) {
        this.store = store;
        this.lookback = lookback;
    }

    public List<MemoryEcho> relevantEchoes(Signal signal, Instant now) {
        return store.query(signal.asset(), signal.patternClass(), lookback, now);
    }

    /**
     * Mean success rate of the relevant echoes, 0.5 with no history.
     */
    public double contextMultiplier(Signal signal, Instant now) {
        return contextMultiplier(relevantEchoes(signal, now));
    }

    public static double contextMultiplier(List<MemoryEcho> echoes) {
        if (echoes == null || echoes.isEmpty()) {
            return NEUTRAL;
        }
        return echoes.stream().mapToDouble(MemoryEcho::successRate).average().orElse(NEUTRAL);
    }

    /**
     * Similarity of a candidate signal to a completed cycle's echo, 0..1.
     *
     * Same pattern class counts for half; emotional and volatility context
     * closeness a quarter each.
     */
    public static double memoryMatch(MemoryEcho echo, Signal candidate) {
        double pattern = Objects.equals(echo.patternClass(), candidate.patternClass()) ? 1.0 : 0.0;
        double emotional = 1.0 - Math.min(1.0, Math.abs(echo.emotionalContext() - candidate.emotionalContext()));
        // a 10-point volatility gap counts as no match
        double volatility = 1.0 - Math.min(1.0, Math.abs(echo.volatilityContext() - candidate.volatilityContext()) * 10.0);
        return clampUnit(0.5 * pattern + 0.25 * emotional + 0.25 * volatility);
    }

    public static double clampUnit(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
