package io.relaydb.spring.boot;

import io.relaydb.jdbc.migration.MigrationRunner;
import io.relaydb.migration.SchemaVersion;
import org.springframework.beans.factory.InitializingBean;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Upgrades the schema while the application context is refreshed. A failed migration
 * or backfill propagates and aborts startup.
 */
public class SchemaMigrationInitializer implements InitializingBean {
    private static final Logger logger = Logger.getLogger(SchemaMigrationInitializer.class.getName());

    private final MigrationRunner runner;
    private final boolean rebuildTags;
    private volatile long schemaVersion = -1;

    public SchemaMigrationInitializer(MigrationRunner runner, boolean rebuildTags) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.rebuildTags = rebuildTags;
    }

    @Override
    public void afterPropertiesSet() {
        boolean rebuildPending = rebuildTags && isTagRebuildPending();
        schemaVersion = runner.upgrade();
        if (!rebuildTags) {
            return;
        }
        if (rebuildPending) {
            logger.info("relaydb.migration.rebuild-tags is set, tag table already rebuilt by the upgrade");
            return;
        }
        logger.info("relaydb.migration.rebuild-tags is set, rebuilding the tag table");
        runner.runBackfill(SchemaVersion.TAG_VALUE_HEX);
    }

    // The upgrade runs the rebuild itself when it applies the value_hex migration.
    private boolean isTagRebuildPending() {
        runner.ensureLedger();
        return runner.pendingMigrations().stream()
                .anyMatch(m -> m.serialNumber() == SchemaVersion.TAG_VALUE_HEX);
    }

    /**
     * Schema version reached at startup, or {@code -1} before initialization.
     */
    public long schemaVersion() {
        return schemaVersion;
    }
}
