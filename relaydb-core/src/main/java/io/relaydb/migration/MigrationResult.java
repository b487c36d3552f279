package io.relaydb.migration;

/**
 * Outcome of applying a single migration.
 */
public enum MigrationResult {
    /** The migration ran and its serial number was recorded. */
    UPGRADED,
    /** The ledger already recorded the migration. */
    NOT_NEEDED
}
