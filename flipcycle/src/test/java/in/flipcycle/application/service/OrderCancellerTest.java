package in.flipcycle.application.service;

import in.flipcycle.application.port.output.ExchangeConnector;
import in.flipcycle.application.port.output.OrderCancellationException;
import in.flipcycle.config.LifecycleConfig;
import in.flipcycle.support.MutableClock;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderCanceller.
 *
 * Tests:
 * - Confirmed cancellations
 * - Backoff between unconfirmed attempts
 * - Giving up after max attempts or the batch deadline
 */
@ExtendWith(MockitoExtension.class)
class OrderCancellerTest {

    @Mock
    private ExchangeConnector exchange;

    private final List<Duration> sleeps = new ArrayList<>();
    private OrderCanceller canceller;

    @BeforeEach
    void setUp() {
        canceller = new OrderCanceller(exchange, LifecycleConfig.defaults(), sleeps::add,
            new MutableClock(TestSignals.T0));
    }

    private static CompletableFuture<Boolean> confirmed(boolean value) {
        return CompletableFuture.completedFuture(value);
    }

    @Test
    void testAllConfirmed() {
        when(exchange.cancelOrder("O-1")).thenReturn(confirmed(true));
        when(exchange.cancelOrder("O-2")).thenReturn(confirmed(true));

        OrderCanceller.Result result = canceller.cancelAll("CYC-1", List.of("O-1", "O-2"));

        assertTrue(result.allCancelled());
        assertEquals(List.of("O-1", "O-2"), result.cancelled());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testRetriesWithBackoffUntilConfirmed() {
        when(exchange.cancelOrder("O-1"))
            .thenReturn(confirmed(false))
            .thenReturn(CompletableFuture.failedFuture(new OrderCancellationException("O-1", "busy")))
            .thenReturn(confirmed(true));

        OrderCanceller.Result result = canceller.cancelAll("CYC-1", List.of("O-1"));

        assertEquals(List.of("O-1"), result.cancelled());
        assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(400)), sleeps);
        verify(exchange, times(3)).cancelOrder("O-1");
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        when(exchange.cancelOrder("O-1")).thenReturn(confirmed(false));
        when(exchange.cancelOrder("O-2")).thenReturn(confirmed(true));

        OrderCanceller.Result result = canceller.cancelAll("CYC-1", List.of("O-1", "O-2"));

        assertFalse(result.allCancelled());
        assertEquals(List.of("O-1"), result.failed());
        assertEquals(List.of("O-2"), result.cancelled());
        verify(exchange, times(5)).cancelOrder("O-1");
        assertEquals(4, sleeps.size());
    }

    @Test
    void testDeadlineStopsRetries() {
        // every clock read moves 20s, so the 30s batch budget runs out on the second attempt
        canceller = new OrderCanceller(exchange, LifecycleConfig.defaults(), sleeps::add,
            new MutableClock(TestSignals.T0, Duration.ofSeconds(20)));
        when(exchange.cancelOrder("O-1")).thenReturn(confirmed(false));

        OrderCanceller.Result result = canceller.cancelAll("CYC-1", List.of("O-1"));

        assertEquals(List.of("O-1"), result.failed());
        verify(exchange, atMost(2)).cancelOrder("O-1");
    }

    @Test
    void testEmptyBatch() {
        OrderCanceller.Result result = canceller.cancelAll("CYC-1", List.of());

        assertTrue(result.allCancelled());
        verifyNoInteractions(exchange);
    }
}
