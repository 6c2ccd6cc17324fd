package in.flipcycle.domain.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of structural signal validation.
 */
public record ValidationResult(
    boolean passed,
    List<String> errors
) {
    public static ValidationResult pass() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * Human-readable summary of all errors.
     */
    public String reason() {
        return passed ? "valid" : String.join("; ", errors);
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final List<String> errors = new ArrayList<>();

        public Builder addError(String error) {
            errors.add(error);
            return this;
        }

        public Builder check(boolean condition, String error) {
            if (!condition) {
                errors.add(error);
            }
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return errors.isEmpty() ? ValidationResult.pass() : ValidationResult.fail(errors);
        }
    }
}
