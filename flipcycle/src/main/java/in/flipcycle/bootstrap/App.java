package in.flipcycle.bootstrap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.flipcycle.application.monitoring.AlertService;
import in.flipcycle.application.port.output.ReserveTransferPort;
import in.flipcycle.application.service.LifecycleController;
import in.flipcycle.config.ConfigLoader;
import in.flipcycle.config.FlipConfig;
import in.flipcycle.domain.cycle.SubmissionResult;
import in.flipcycle.domain.signal.Direction;
import in.flipcycle.domain.signal.Signal;
import in.flipcycle.infrastructure.metrics.PrometheusCycleMetrics;
import in.flipcycle.infrastructure.paper.PaperExchange;
import in.flipcycle.infrastructure.persistence.JsonFileCycleSnapshotRepository;
import in.flipcycle.infrastructure.persistence.JsonLinesHistoryStore;
import in.flipcycle.infrastructure.persistence.JsonMappers;
import in.flipcycle.transport.http.MonitoringServer;
import in.flipcycle.util.Env;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Paper-trading entry point.
 *
 * Wires the lifecycle controller to the in-process PaperExchange, JSON file
 * persistence under FLIPCYCLE_DATA_DIR and the monitoring server on
 * FLIPCYCLE_HTTP_PORT. Signals are read from the JSON array file named by
 * FLIPCYCLE_SIGNALS, if set.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FlipCycle Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        FlipConfig config = ConfigLoader.load();
        StartupConfigValidator.validate(config);

        if ("LIVE".equalsIgnoreCase(Env.get("FLIPCYCLE_MODE", "PAPER"))) {
            throw new IllegalStateException("❌ LIVE mode needs an exchange connector; this build only ships the paper exchange");
        }

        Path dataDir = Path.of(Env.get("FLIPCYCLE_DATA_DIR", "./data"));
        int httpPort = Env.getInt("FLIPCYCLE_HTTP_PORT", 9090);
        double walkVolatility = Env.getDouble("FLIPCYCLE_PAPER_VOLATILITY", 0.004);
        int walkSeconds = Env.getInt("FLIPCYCLE_PAPER_TICK_SECONDS", 5);

        ObjectMapper mapper = JsonMappers.create();
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Infrastructure
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        PrometheusCycleMetrics metrics = new PrometheusCycleMetrics(registry);
        log.info("✓ Prometheus metrics initialized");

        JsonFileCycleSnapshotRepository snapshots = new JsonFileCycleSnapshotRepository(dataDir.resolve("cycles"));
        JsonLinesHistoryStore history = new JsonLinesHistoryStore(dataDir.resolve("history.jsonl"));
        log.info("✓ Persistence under {} ({} echoes loaded)", dataDir.toAbsolutePath(), history.all().size());

        PaperExchange paper = new PaperExchange(clock);
        AlertService alerts = new AlertService(clock);
        ReserveTransferPort paperVault = (amount, reference) -> {
            log.info("[PAPER] Reserve transfer {} of {}", reference, amount);
            return true;
        };

        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(
            schedulerThreads(config),
            r -> {
                Thread t = new Thread(r, "flipcycle-runner");
                t.setDaemon(true);
                return t;
            });

        LifecycleController controller = LifecycleController.builder()
            .config(config)
            .priceFeed(paper)
            .exchange(paper)
            .alerts(alerts)
            .snapshots(snapshots)
            .history(history)
            .reserveTransfer(paperVault)
            .scheduler(scheduler)
            .metrics(metrics)
            .clock(clock)
            .build();
        log.info("✓ Lifecycle controller ready (max {} cycles, capital {})",
            config.lifecycle().maxConcurrentCycles(), controller.capitalPool().available());

        MonitoringServer server = new MonitoringServer(httpPort, controller, registry, mapper);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down FlipCycle...");
            controller.shutdown();
            server.stop();
            scheduler.shutdownNow();
        }, "flipcycle-shutdown"));

        // ═══════════════════════════════════════════════════════════════
        // Paper market + signals
        // ═══════════════════════════════════════════════════════════════
        List<Signal> signals = loadSignals(mapper, Env.get("FLIPCYCLE_SIGNALS", ""));
        for (Signal signal : signals) {
            if (paper.currentPrice(signal.asset()) == null && signal.entryHigh() != null) {
                paper.setPrice(signal.asset(), signal.entryHigh());
            }
        }
        scheduler.scheduleAtFixedRate(() -> paper.randomWalk(walkVolatility), walkSeconds, walkSeconds, TimeUnit.SECONDS);
        log.info("✓ Paper market running ({}s ticks, volatility {})", walkSeconds, walkVolatility);

        for (Signal signal : signals) {
            SubmissionResult result = controller.submit(signal);
            log.info("Signal {} -> {} {}", signal.signalId(),
                result.isRejected() ? "REJECTED" : result.status(), result.reason());
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FlipCycle started (PAPER) on http://localhost:{}/health ===", server.boundPort());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    /**
     * One runner thread per concurrent cycle plus one, since an exiting cycle
     * holds its thread through the cancel backoff. FLIPCYCLE_THREADS can only
     * raise it.
     */
    static int schedulerThreads(FlipConfig config) {
        int minimum = config.lifecycle().maxConcurrentCycles() + 1;
        return Math.max(minimum, Env.getInt("FLIPCYCLE_THREADS", minimum));
    }

    static List<Signal> loadSignals(ObjectMapper mapper, String file) {
        if (file == null || file.isBlank()) {
            log.info("No FLIPCYCLE_SIGNALS file, waiting without signals");
            return List.of();
        }
        try {
            List<Signal> raw = mapper.readValue(Files.readString(Path.of(file)), new TypeReference<List<Signal>>() {});
            log.info("✓ Loaded {} signals from {}", raw.size(), file);
            return raw.stream().map(App::withDefaults).toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read signals from " + file + ": " + e.getMessage(), e);
        }
    }

    // Fill in id, direction and arrival time a hand-written file may omit
    static Signal withDefaults(Signal signal) {
        return signal.toBuilder()
            .direction(signal.direction() != null ? signal.direction() : Direction.BUY)
            .patternClass(signal.patternClass() != null ? signal.patternClass() : "UNCLASSIFIED")
            .source(signal.source() != null ? signal.source() : "file")
            .build();
    }
}
