package in.flipcycle.service.vault;

import in.flipcycle.application.port.output.ReserveTransferPort;
import in.flipcycle.config.VaultConfig;
import in.flipcycle.domain.vault.ReserveTransfer;
import in.flipcycle.domain.vault.VaultLedgerEntry;
import in.flipcycle.support.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VaultAllocator.
 *
 * Tests:
 * - 30/70 split and working-capital credit
 * - Batched reserve transfers
 * - Failed transfers keep the balance pending
 * - Concurrent allocations lose nothing
 */
class VaultAllocatorTest {

    private final Clock clock = Clock.fixed(TestSignals.T0, ZoneOffset.UTC);
    private VaultLedger ledger;
    private CapitalPool pool;
    private ReserveTransferPort transfers;
    private VaultAllocator allocator;

    @BeforeEach
    void setUp() {
        ledger = new VaultLedger();
        pool = new CapitalPool(BigDecimal.ZERO);
        transfers = mock(ReserveTransferPort.class);
        allocator = new VaultAllocator(ledger, VaultConfig.defaults(), transfers, pool, clock);
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Test
    void testSplitsProfitThirtySeventy() {
        when(transfers.transfer(any(), anyString())).thenReturn(true);

        VaultLedgerEntry entry = allocator.allocate("CYC-1", bd("1000")).orElseThrow();

        assertEquals(0, entry.reserveAmount().compareTo(bd("300")));
        assertEquals(0, entry.workingRetained().compareTo(bd("700")));
        assertEquals(0, entry.reserveAmount().add(entry.workingRetained()).compareTo(entry.grossProfit()));
        assertEquals(0.30, entry.siphonRate(), 1e-9);
        assertEquals(TestSignals.T0, entry.timestamp());
        assertEquals(0, pool.available().compareTo(bd("700")), "Working share goes back to the pool");

        verify(transfers).transfer(eq(bd("300.00000000")), startsWith("RT-"));
        assertEquals(0, ledger.transferredReserve().compareTo(bd("300")));
        assertEquals(0, ledger.pendingReserve().signum());
        assertEquals(List.of(entry.entryId()), ledger.transfers().get(0).entryIds());
    }

    @Test
    void testNoAllocationWithoutProfit() {
        assertEquals(Optional.empty(), allocator.allocate("CYC-1", bd("-50")));
        assertEquals(Optional.empty(), allocator.allocate("CYC-2", BigDecimal.ZERO));
        assertEquals(Optional.empty(), allocator.allocate("CYC-3", null));

        assertTrue(ledger.entries().isEmpty());
        verifyNoInteractions(transfers);
    }

    @Test
    void testReserveBatchedUntilAboveMinimum() {
        when(transfers.transfer(any(), anyString())).thenReturn(true);

        VaultLedgerEntry first = allocator.allocate("CYC-1", bd("20")).orElseThrow();
        assertEquals(0, ledger.pendingReserve().compareTo(bd("6")));
        verifyNoInteractions(transfers);

        VaultLedgerEntry second = allocator.allocate("CYC-2", bd("20")).orElseThrow();

        verify(transfers).transfer(eq(bd("12.00000000")), anyString());
        ReserveTransfer transfer = ledger.transfers().get(0);
        assertEquals(List.of(first.entryId(), second.entryId()), transfer.entryIds());
        assertEquals(0, ledger.pendingReserve().signum());
    }

    @Test
    void testUnconfirmedTransferStaysPending() {
        when(transfers.transfer(any(), anyString())).thenReturn(false).thenReturn(true);

        allocator.allocate("CYC-1", bd("100"));
        assertEquals(0, ledger.pendingReserve().compareTo(bd("30")));
        assertTrue(ledger.transfers().isEmpty());

        allocator.allocate("CYC-2", bd("100"));
        assertEquals(0, ledger.transferredReserve().compareTo(bd("60")), "Retry carries the earlier balance");
        assertEquals(0, ledger.pendingReserve().signum());
    }

    @Test
    void testTransferExceptionStaysPending() {
        when(transfers.transfer(any(), anyString())).thenThrow(new IllegalStateException("vault offline"));

        Optional<VaultLedgerEntry> entry = allocator.allocate("CYC-1", bd("100"));

        assertTrue(entry.isPresent(), "The split is recorded even when the transfer fails");
        assertEquals(0, ledger.pendingReserve().compareTo(bd("30")));
        assertEquals(0, pool.available().compareTo(bd("70")));
    }

    @Test
    void testConcurrentAllocationsLoseNothing() throws Exception {
        when(transfers.transfer(any(), anyString())).thenReturn(true);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                final int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        allocator.allocate("CYC-" + thread + "-" + i, bd("10"));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(200, ledger.entries().size());
        assertEquals(0, ledger.totalReserve().compareTo(bd("600")));
        assertEquals(0, pool.available().compareTo(bd("1400")));
        BigDecimal transferred = ledger.transfers().stream()
            .map(ReserveTransfer::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, transferred.compareTo(ledger.transferredReserve()));
    }

    @Test
    void testContendedLockWaitsInsteadOfDropping() throws Exception {
        VaultConfig impatient = new VaultConfig(0.30, bd("10"), bd("0.01"), 2, 10);
        allocator = new VaultAllocator(ledger, impatient, transfers, pool, clock);

        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> ledger.writeBlocking(() -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        assertThrows(VaultWriteConflictException.class,
            () -> ledger.write("CYC-X", Duration.ofMillis(10), () -> null));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<VaultLedgerEntry>> pending = executor.submit(() -> allocator.allocate("CYC-1", bd("5")));
            Thread.sleep(100);
            assertFalse(pending.isDone(), "Allocation waits for the lock");

            release.countDown();
            assertTrue(pending.get(5, TimeUnit.SECONDS).isPresent());
        } finally {
            executor.shutdownNow();
            holder.join(5000);
        }
        assertEquals(1, ledger.entries().size());
    }
}
