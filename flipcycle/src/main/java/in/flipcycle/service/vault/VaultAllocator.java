package in.flipcycle.service.vault;

import in.flipcycle.application.port.output.ReserveTransferPort;
import in.flipcycle.config.VaultConfig;
import in.flipcycle.domain.vault.ReserveTransfer;
import in.flipcycle.domain.vault.VaultLedgerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Splits realized profit between the protected reserve and working capital.
 *
 * Reserve accrues into a pending balance that is transferred in batches once
 * it exceeds minTransferAmount. A failed transfer leaves the balance pending
 * for the next allocation. Lock contention is retried; after the bounded
 * attempts the write waits for the lock instead of being dropped.
 */
public final class VaultAllocator {
    private static final Logger log = LoggerFactory.getLogger(VaultAllocator.class);

    private static final int MONEY_SCALE = 8;

    private final VaultLedger ledger;
    private final VaultConfig config;
    private final ReserveTransferPort transferPort;
    private final CapitalPool capitalPool;
    private final Clock clock;

    public VaultAllocator(VaultLedger ledger, VaultConfig config, ReserveTransferPort transferPort,
                          CapitalPool capitalPool, Clock clock) {
        this.ledger = ledger;
        this.config = config;
        this.transferPort = transferPort;
        this.capitalPool = capitalPool;
        this.clock = clock;
    }

    /**
     * @return the ledger entry, or empty when grossProfit ≤ 0
     */
    public Optional<VaultLedgerEntry> allocate(String cycleId, BigDecimal grossProfit) {
        if (grossProfit == null || grossProfit.signum() <= 0) {
            log.debug("No vault allocation for {}: gross profit {}", cycleId, grossProfit);
            return Optional.empty();
        }

        Duration timeout = Duration.ofMillis(config.lockTimeoutMs());
        for (int attempt = 1; attempt <= config.lockAttempts(); attempt++) {
            try {
                return Optional.of(ledger.write(cycleId, timeout, () -> split(cycleId, grossProfit)));
            } catch (VaultWriteConflictException e) {
                log.warn("VAULT_WRITE_CONFLICT attempt {}/{}: {}", attempt, config.lockAttempts(), e.getMessage());
            }
        }
        log.warn("Vault lock still contended for {}, waiting for it", cycleId);
        return Optional.of(ledger.writeBlocking(() -> split(cycleId, grossProfit)));
    }

    public VaultLedger ledger() {
        return ledger;
    }

    // Runs under the ledger lock
    private VaultLedgerEntry split(String cycleId, BigDecimal grossProfit) {
        BigDecimal reserve = grossProfit.multiply(BigDecimal.valueOf(config.siphonRate()))
            .setScale(MONEY_SCALE, RoundingMode.HALF_DOWN);
        BigDecimal working = grossProfit.subtract(reserve);
        Instant now = clock.instant();

        VaultLedgerEntry entry = new VaultLedgerEntry(
            "VLE-" + UUID.randomUUID(), cycleId, grossProfit, reserve, working, config.siphonRate(), now);
        ledger.record(entry);
        capitalPool.credit(working);

        log.info("💰 Vault split for {}: gross {} -> reserve {} / working {} (pending reserve {})",
            cycleId, grossProfit, reserve, working, ledger.pendingReserveUnlocked());

        maybeTransfer(now);
        return entry;
    }

    private void maybeTransfer(Instant now) {
        BigDecimal pending = ledger.pendingReserveUnlocked();
        if (pending.compareTo(config.minTransferAmount()) <= 0) {
            return;
        }
        String transferId = "RT-" + UUID.randomUUID();
        List<String> entryIds = ledger.pendingEntryIdsUnlocked();
        boolean confirmed;
        try {
            confirmed = transferPort.transfer(pending, transferId);
        } catch (RuntimeException e) {
            log.error("Reserve transfer {} of {} failed, keeping balance pending: {}", transferId, pending, e.getMessage(), e);
            return;
        }
        if (!confirmed) {
            log.warn("Reserve transfer {} of {} not confirmed, keeping balance pending", transferId, pending);
            return;
        }
        ledger.completeTransfer(new ReserveTransfer(transferId, pending, entryIds, now));
        log.info("🏦 Reserve transfer {} completed: {} ({} entries)", transferId, pending, entryIds.size());
    }
}
