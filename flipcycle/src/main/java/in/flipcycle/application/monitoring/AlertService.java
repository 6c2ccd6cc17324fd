package in.flipcycle.application.monitoring;

import in.flipcycle.application.port.output.AlertNotifier;
import in.flipcycle.domain.monitoring.Alert;
import in.flipcycle.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Alert notification service.
 *
 * Always logs through SLF4J by severity, then fans out to any registered
 * channels (chat webhook, pager, ...). Channel failures are logged and
 * dropped: alerting must never break the lifecycle.
 */
public final class AlertService implements AlertNotifier {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final Clock clock;
    private final List<Consumer<Alert>> channels = new CopyOnWriteArrayList<>();

    public AlertService() {
        this(Clock.systemUTC());
    }

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    public void addChannel(Consumer<Alert> channel) {
        channels.add(channel);
    }

    @Override
    public void notify(String message, AlertLevel priority) {
        sendAlert(new Alert(priority, message, clock.instant()));
    }

    /**
     * Send alert to configured channels.
     */
    public void sendAlert(Alert alert) {
        switch (alert.level()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {}", alert.message());
            case HIGH -> log.warn("[ALERT-HIGH] {}", alert.message());
            case MEDIUM -> log.warn("[ALERT-MEDIUM] {}", alert.message());
            case INFO -> log.info("[ALERT-INFO] {}", alert.message());
        }

        for (Consumer<Alert> channel : channels) {
            try {
                channel.accept(alert);
            } catch (RuntimeException e) {
                log.warn("Alert channel failed for {}: {}", alert.level(), e.getMessage());
            }
        }
    }
}
