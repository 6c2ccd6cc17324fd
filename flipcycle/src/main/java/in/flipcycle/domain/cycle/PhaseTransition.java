package in.flipcycle.domain.cycle;

import java.time.Instant;

public record PhaseTransition(FlipPhase phase, Instant at) {
}
