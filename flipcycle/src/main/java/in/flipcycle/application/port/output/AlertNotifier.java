package in.flipcycle.application.port.output;

import in.flipcycle.domain.monitoring.AlertLevel;

/**
 * Alert collaborator. Fire-and-forget; callers never depend on delivery.
 */
public interface AlertNotifier {

    void notify(String message, AlertLevel priority);
}
