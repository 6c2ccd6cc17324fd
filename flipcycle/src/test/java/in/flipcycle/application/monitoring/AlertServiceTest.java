package in.flipcycle.application.monitoring;

import in.flipcycle.domain.monitoring.Alert;
import in.flipcycle.domain.monitoring.AlertLevel;
import in.flipcycle.support.MutableClock;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AlertService.
 *
 * Tests:
 * - fan-out to every channel with level, message and clock timestamp
 * - a failing channel does not block the others
 */
class AlertServiceTest {

    @Test
    void testNotifyFansOutToChannels() {
        MutableClock clock = new MutableClock(TestSignals.T0);
        AlertService service = new AlertService(clock);
        List<Alert> received = new ArrayList<>();
        service.addChannel(received::add);

        clock.advance(Duration.ofMinutes(5));
        service.notify("Cycle CYC-1 needs manual intervention", AlertLevel.CRITICAL);

        assertEquals(1, received.size());
        Alert alert = received.get(0);
        assertEquals(AlertLevel.CRITICAL, alert.level());
        assertEquals("Cycle CYC-1 needs manual intervention", alert.message());
        assertEquals(TestSignals.T0.plus(Duration.ofMinutes(5)), alert.raisedAt());
    }

    @Test
    void testFailingChannelDoesNotBlockOthers() {
        AlertService service = new AlertService(new MutableClock(TestSignals.T0));
        List<Alert> received = new ArrayList<>();
        service.addChannel(alert -> {
            throw new IllegalStateException("webhook down");
        });
        service.addChannel(received::add);

        assertDoesNotThrow(() -> service.notify("Price feed failing", AlertLevel.MEDIUM));
        assertEquals(1, received.size(), "Second channel still notified");
    }
}
