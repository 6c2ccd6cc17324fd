package in.flipcycle.service.vault;

import in.flipcycle.domain.vault.ReserveTransfer;
import in.flipcycle.domain.vault.VaultLedgerEntry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutex-guarded record of profit splits, pending reserve and completed
 * transfers.
 *
 * All mutation goes through write(...) or writeBlocking(...); reads take the
 * same lock so they never observe a half-applied split.
 */
public final class VaultLedger {

    private final ReentrantLock lock = new ReentrantLock(true);

    private final List<VaultLedgerEntry> entries = new ArrayList<>();
    private final List<ReserveTransfer> transfers = new ArrayList<>();
    private final List<String> pendingEntryIds = new ArrayList<>();
    private BigDecimal pendingReserve = BigDecimal.ZERO;
    private BigDecimal transferredReserve = BigDecimal.ZERO;

    /**
     * Run action under the lock, waiting at most timeout.
     *
     * @throws VaultWriteConflictException if the lock was not acquired
     */
    public <T> T write(String cycleId, Duration timeout, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VaultWriteConflictException(cycleId, timeout.toMillis());
        }
        if (!acquired) {
            throw new VaultWriteConflictException(cycleId, timeout.toMillis());
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run action under the lock, waiting as long as it takes.
     */
    public <T> T writeBlocking(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    // Mutators below must be called from inside write(...)

    void record(VaultLedgerEntry entry) {
        entries.add(entry);
        pendingReserve = pendingReserve.add(entry.reserveAmount());
        pendingEntryIds.add(entry.entryId());
    }

    void completeTransfer(ReserveTransfer transfer) {
        transfers.add(transfer);
        transferredReserve = transferredReserve.add(transfer.amount());
        pendingReserve = BigDecimal.ZERO;
        pendingEntryIds.clear();
    }

    BigDecimal pendingReserveUnlocked() {
        return pendingReserve;
    }

    List<String> pendingEntryIdsUnlocked() {
        return List.copyOf(pendingEntryIds);
    }

    // Reads

    public List<VaultLedgerEntry> entries() {
        return writeBlocking(() -> List.copyOf(entries));
    }

    public List<ReserveTransfer> transfers() {
        return writeBlocking(() -> List.copyOf(transfers));
    }

    public BigDecimal pendingReserve() {
        return writeBlocking(() -> pendingReserve);
    }

    public BigDecimal transferredReserve() {
        return writeBlocking(() -> transferredReserve);
    }

    /**
     * Reserve ever siphoned: transferred plus pending.
     */
    public BigDecimal totalReserve() {
        return writeBlocking(() -> transferredReserve.add(pendingReserve));
    }
}
