package in.flipcycle.bootstrap;

import in.flipcycle.config.FlipConfig;
import in.flipcycle.config.ScoringConfig;
import in.flipcycle.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Validates configuration at startup before the engine initializes.
 * Throws IllegalStateException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration at startup.
     *
     * Call from App.main() BEFORE any component is built. If validation
     * fails the engine refuses to start.
     *
     * @param config loaded configuration
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(FlipConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        requireValid("scoring", config.scoring().isValid());
        requireValid("ladder", config.ladder().isValid());
        requireValid("exit", config.exit().isValid());
        requireValid("vault", config.vault().isValid());
        requireValid("lifecycle", config.lifecycle().isValid());

        ScoringConfig scoring = config.scoring();
        if (scoring.cognitiveExitThreshold() >= scoring.rejectionThreshold()) {
            log.warn("⚠️  cognitiveExitThreshold {} >= rejectionThreshold {}: freshly admitted cycles may exit on the first check",
                scoring.cognitiveExitThreshold(), scoring.rejectionThreshold());
        }
        log.info("✓ Scoring weights {} (threshold {}, cognitive exit {})",
            scoring.weights(), scoring.rejectionThreshold(), scoring.cognitiveExitThreshold());

        boolean liveMode = "LIVE".equalsIgnoreCase(Env.get("FLIPCYCLE_MODE", "PAPER"));
        log.info("Mode: {}", liveMode ? "LIVE" : "PAPER");
        if (liveMode) {
            boolean orderExecutionEnabled = Env.getBool("ORDER_EXECUTION_ENABLED", false);
            if (!orderExecutionEnabled) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: LIVE mode requires ORDER_EXECUTION_ENABLED=true\n" +
                    "System refuses to start.\n" +
                    "Either:\n" +
                    "  1. Enable order execution: set ORDER_EXECUTION_ENABLED=true\n" +
                    "  2. Set FLIPCYCLE_MODE=PAPER for paper trading"
                );
            }
            log.info("✓ Order execution enabled");
        } else {
            log.warn("⚠️  PAPER mode - orders go to the in-process paper exchange");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void requireValid(String section, boolean valid) {
        if (!valid) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: section '" + section + "' has out-of-range values\n" +
                "System refuses to start."
            );
        }
        log.info("✓ {} config valid", section);
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
