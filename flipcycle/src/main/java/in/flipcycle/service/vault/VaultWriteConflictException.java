package in.flipcycle.service.vault;

/**
 * Thrown when the vault ledger lock could not be acquired in time.
 */
public class VaultWriteConflictException extends RuntimeException {

    private final String cycleId;

    public VaultWriteConflictException(String cycleId, long waitedMs) {
        super(String.format("Vault ledger busy for cycle %s after %dms", cycleId, waitedMs));
        this.cycleId = cycleId;
    }

    public String getCycleId() {
        return cycleId;
    }
}
