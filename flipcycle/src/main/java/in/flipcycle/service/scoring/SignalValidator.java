package in.flipcycle.service.scoring;

import in.flipcycle.domain.common.ValidationResult;
import in.flipcycle.domain.signal.Signal;

import java.math.BigDecimal;

/**
 * Structural validation of incoming signals.
 *
 * Only long ladders are supported: a SELL signal is invalid.
 */
public final class SignalValidator {

    public ValidationResult validate(Signal signal) {
        ValidationResult.Builder builder = new ValidationResult.Builder();
        if (signal == null) {
            return builder.addError("signal is null").build();
        }

        builder.check(signal.asset() != null && !signal.asset().isBlank(), "asset is required");
        builder.check(signal.direction() != null, "direction is required");
        if (signal.direction() != null) {
            builder.check(signal.isLong(), "only BUY signals can be laddered, got " + signal.direction());
        }

        BigDecimal low = signal.entryLow();
        BigDecimal high = signal.entryHigh();
        builder.check(positive(low), "entryLow must be > 0");
        builder.check(positive(high), "entryHigh must be > 0");
        if (positive(low) && positive(high)) {
            builder.check(high.compareTo(low) > 0,
                String.format("entry band is empty (low %s, high %s)", low, high));
        }

        builder.check(positive(signal.targetPrice()), "targetPrice must be > 0");
        builder.check(positive(signal.stopPrice()), "stopPrice must be > 0");
        if (positive(high) && positive(signal.targetPrice())) {
            builder.check(signal.targetPrice().compareTo(high) > 0,
                String.format("target %s must be above entry %s", signal.targetPrice(), high));
        }
        if (positive(low) && positive(signal.stopPrice())) {
            builder.check(signal.stopPrice().compareTo(low) < 0,
                String.format("stop %s must be below entry %s", signal.stopPrice(), low));
        }

        builder.check(positive(signal.capital()), "capital must be > 0");
        builder.check(signal.confidence() >= 0.0 && signal.confidence() <= 1.0,
            "confidence must be within 0..1, got " + signal.confidence());

        return builder.build();
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
