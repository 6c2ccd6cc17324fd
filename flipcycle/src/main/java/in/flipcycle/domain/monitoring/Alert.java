package in.flipcycle.domain.monitoring;

import java.time.Instant;
import java.util.Objects;

/**
 * One alert raised by the lifecycle, stamped with the service clock.
 */
public record Alert(AlertLevel level, String message, Instant raisedAt) {

    public Alert {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(raisedAt, "raisedAt");
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (%s)", level, message, raisedAt);
    }
}
