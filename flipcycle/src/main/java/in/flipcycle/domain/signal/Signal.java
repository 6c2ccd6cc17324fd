package in.flipcycle.domain.signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A candidate trade opportunity for one asset.
 *
 * The entry is a band (entryLow..entryHigh) rather than a single price so the
 * ladder can spread rungs across it. Structural checks live in SignalValidator,
 * not here, so that a malformed signal can still be scored and explained.
 */
public record Signal(
    String signalId,
    String asset,
    Direction direction,
    BigDecimal entryLow,
    BigDecimal entryHigh,
    BigDecimal targetPrice,
    BigDecimal stopPrice,
    BigDecimal capital,
    double confidence,          // source confidence, 0..1
    String patternClass,        // e.g. MOMENTUM, WHALE_ACCUMULATION
    double emotionalContext,    // crowd sentiment at arrival, 0..1
    double volatilityContext,   // realised volatility at arrival (fraction, 0.04 = 4%)
    String source,
    boolean immediateExecution, // pre-fill the first rung at market
    Instant receivedAt
) {
    /**
     * Midpoint of the entry band, used as the reference entry for scoring.
     */
    public BigDecimal entryMidpoint() {
        if (entryLow == null || entryHigh == null) {
            return entryLow != null ? entryLow : entryHigh;
        }
        return entryLow.add(entryHigh).divide(BigDecimal.valueOf(2), 8, RoundingMode.HALF_UP);
    }

    public boolean isLong() {
        return direction == Direction.BUY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .signalId(signalId)
            .asset(asset)
            .direction(direction)
            .entryBand(entryLow, entryHigh)
            .targetPrice(targetPrice)
            .stopPrice(stopPrice)
            .capital(capital)
            .confidence(confidence)
            .patternClass(patternClass)
            .emotionalContext(emotionalContext)
            .volatilityContext(volatilityContext)
            .source(source)
            .immediateExecution(immediateExecution)
            .receivedAt(receivedAt);
    }

    public static class Builder {
        private String signalId;
        private String asset;
        private Direction direction = Direction.BUY;
        private BigDecimal entryLow;
        private BigDecimal entryHigh;
        private BigDecimal targetPrice;
        private BigDecimal stopPrice;
        private BigDecimal capital;
        private double confidence = 0.5;
        private String patternClass = "UNCLASSIFIED";
        private double emotionalContext = 0.5;
        private double volatilityContext = 0.0;
        private String source = "manual";
        private boolean immediateExecution = false;
        private Instant receivedAt;

        public Builder signalId(String signalId) { this.signalId = signalId; return this; }
        public Builder asset(String asset) { this.asset = asset; return this; }
        public Builder direction(Direction direction) { this.direction = direction; return this; }
        public Builder entryBand(BigDecimal low, BigDecimal high) {
            this.entryLow = low;
            this.entryHigh = high;
            return this;
        }
        public Builder entryBand(double low, double high) {
            return entryBand(BigDecimal.valueOf(low), BigDecimal.valueOf(high));
        }
        public Builder targetPrice(BigDecimal targetPrice) { this.targetPrice = targetPrice; return this; }
        public Builder targetPrice(double targetPrice) { return targetPrice(BigDecimal.valueOf(targetPrice)); }
        public Builder stopPrice(BigDecimal stopPrice) { this.stopPrice = stopPrice; return this; }
        public Builder stopPrice(double stopPrice) { return stopPrice(BigDecimal.valueOf(stopPrice)); }
        public Builder capital(BigDecimal capital) { this.capital = capital; return this; }
        public Builder capital(double capital) { return capital(BigDecimal.valueOf(capital)); }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder patternClass(String patternClass) { this.patternClass = patternClass; return this; }
        public Builder emotionalContext(double emotionalContext) { this.emotionalContext = emotionalContext; return this; }
        public Builder volatilityContext(double volatilityContext) { this.volatilityContext = volatilityContext; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder immediateExecution(boolean immediateExecution) { this.immediateExecution = immediateExecution; return this; }
        public Builder receivedAt(Instant receivedAt) { this.receivedAt = receivedAt; return this; }

        public Signal build() {
            return new Signal(
                signalId != null ? signalId : "SIG-" + UUID.randomUUID(),
                asset, direction, entryLow, entryHigh, targetPrice, stopPrice, capital,
                confidence, patternClass, emotionalContext, volatilityContext, source,
                immediateExecution,
                receivedAt != null ? receivedAt : Instant.now());
        }
    }
}
