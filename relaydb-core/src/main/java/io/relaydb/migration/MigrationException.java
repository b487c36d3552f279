package io.relaydb.migration;

/**
 * Unchecked exception raised when a migration, its ledger entry or its backfill fails.
 * The failed migration stays pending; the upgrade stops at this point.
 */
public class MigrationException extends RuntimeException {
    private final long serialNumber;

    public MigrationException(long serialNumber, String message, Throwable cause) {
        super(message, cause);
        this.serialNumber = serialNumber;
    }

    public MigrationException(long serialNumber, String message) {
        super(message);
        this.serialNumber = serialNumber;
    }

    /**
     * Serial number of the migration being processed when the failure happened.
     */
    public long serialNumber() {
        return serialNumber;
    }
}
