package in.flipcycle.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.flipcycle.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads FlipConfig.
 *
 * Lookup order:
 * 1. file named by FLIPCYCLE_CONFIG (env var or system property)
 * 2. flipcycle.json on the classpath
 * 3. built-in defaults
 *
 * The loaded JSON is merged over the defaults, so a file only needs the keys
 * it changes. A few scalar overrides are then read from the environment.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_ENV = "FLIPCYCLE_CONFIG";
    public static final String CLASSPATH_RESOURCE = "flipcycle.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Load configuration using the default lookup order.
     *
     * @throws IllegalStateException if a configuration source exists but cannot be parsed
     */
    public static FlipConfig load() {
        String explicit = Env.get(CONFIG_ENV, null);
        FlipConfig config;
        if (explicit != null) {
            config = loadFile(Paths.get(explicit));
        } else {
            config = loadClasspath(CLASSPATH_RESOURCE);
        }
        return applyEnvOverrides(config);
    }

    /**
     * Load configuration from a file, merged over defaults.
     */
    public static FlipConfig loadFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Config file not found: " + path);
        }
        try {
            String json = Files.readString(path);
            FlipConfig config = parse(json);
            log.info("✅ Loaded flip config from: {}", path);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a classpath resource, or defaults if absent.
     */
    public static FlipConfig loadClasspath(String resource) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", resource);
                return FlipConfig.defaults();
            }
            FlipConfig config = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.info("✅ Loaded flip config from classpath: {}", resource);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config resource " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a JSON document merged over the defaults.
     *
     * @throws IOException if the JSON is malformed or violates a record invariant
     */
    public static FlipConfig parse(String json) throws IOException {
        JsonNode overrides = MAPPER.readTree(json);
        ObjectNode base = MAPPER.valueToTree(FlipConfig.defaults());
        if (overrides != null && overrides.isObject()) {
            merge(base, (ObjectNode) overrides);
        }
        return MAPPER.treeToValue(base, FlipConfig.class);
    }

    static FlipConfig applyEnvOverrides(FlipConfig config) {
        LifecycleConfig lc = config.lifecycle();
        int maxCycles = Env.getInt("FLIPCYCLE_MAX_CYCLES", lc.maxConcurrentCycles());
        if (maxCycles != lc.maxConcurrentCycles()) {
            log.info("Env override: maxConcurrentCycles {} -> {}", lc.maxConcurrentCycles(), maxCycles);
            lc = new LifecycleConfig(lc.initialCapital(), maxCycles, lc.minContextMultiplier(),
                lc.memoryLookbackDays(), lc.pollIntervalSeconds(), lc.cognitiveIntervalSeconds(),
                lc.decayWindowMinutes(), lc.priceTimeoutMs(), lc.orderTimeoutMs(), lc.priceFailureWarnThreshold(),
                lc.overexposureThreshold(), lc.scoreDecayPerHour(), lc.scoreDecayFloor(),
                lc.riskSignalThreshold(), lc.reentryWindowMinutes(), lc.reentryMemoryMatch(),
                lc.cancelMaxAttempts(), lc.cancelBaseDelayMs(), lc.cancelMaxDelayMs(), lc.cancelTimeoutMs());
            config = config.withLifecycle(lc);
        }
        ScoringConfig sc = config.scoring();
        double threshold = Env.getDouble("FLIPCYCLE_REJECTION_THRESHOLD", sc.rejectionThreshold());
        if (threshold != sc.rejectionThreshold()) {
            log.info("Env override: rejectionThreshold {} -> {}", sc.rejectionThreshold(), threshold);
            config = config.withScoring(new ScoringConfig(sc.weights(), threshold, sc.cognitiveExitThreshold(),
                sc.multiplierBand(), sc.referenceAccount(), sc.majorAssets(), sc.midAssets(),
                sc.holdAssets(), sc.activeAssets()));
        }
        return config;
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private ConfigLoader() {
        // Utility class - no instantiation
    }
}
