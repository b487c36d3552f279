package io.relaydb.spi;

/**
 * Observability hook for exporting schema upgrade counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of migrations applied and committed.
     */
    void incrementMigrationApplied();

    /**
     * Increments the count of migrations skipped because the ledger already records them.
     */
    void incrementMigrationSkipped();

    /**
     * Increments the count of migrations (or their backfills) that failed.
     */
    void incrementMigrationFailed();

    /**
     * Records the time spent applying one migration, in milliseconds.
     */
    void recordMigrationDurationMs(long durationMs);

    /**
     * Records the schema version reported by the ledger after an upgrade.
     */
    void recordSchemaVersion(long version);

    /**
     * Increments the count of events read by a backfill.
     */
    default void incrementBackfillEvents(long count) {
    }

    /**
     * Increments the count of derived rows written by a backfill.
     */
    default void incrementBackfillTags(long count) {
    }

    final class Noop implements MetricsExporter {
        @Override
        public void incrementMigrationApplied() {
        }

        @Override
        public void incrementMigrationSkipped() {
        }

        @Override
        public void incrementMigrationFailed() {
        }

        @Override
        public void recordMigrationDurationMs(long durationMs) {
        }

        @Override
        public void recordSchemaVersion(long version) {
        }
    }
}
