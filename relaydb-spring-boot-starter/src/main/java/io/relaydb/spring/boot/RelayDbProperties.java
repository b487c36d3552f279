package io.relaydb.spring.boot;

import io.relaydb.jdbc.migration.MigrationRunner;
import io.relaydb.progress.LoggingProgressListener;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for schema migration at startup.
 *
 * @see RelayDbAutoConfiguration
 */
@ConfigurationProperties(prefix = "relaydb")
public class RelayDbProperties {

    private final Migration migration = new Migration();
    private final Metrics metrics = new Metrics();

    public Migration getMigration() {
        return migration;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Migration {
        /**
         * Whether to upgrade the schema when the application context starts.
         */
        private boolean enabled = true;

        /**
         * Rows fetched per round-trip while a backfill streams events.
         */
        private int backfillFetchSize = MigrationRunner.DEFAULT_BACKFILL_FETCH_SIZE;

        /**
         * Number of processed events between two backfill progress log lines.
         */
        private long progressLogInterval = LoggingProgressListener.DEFAULT_INTERVAL;

        /**
         * Whether to rebuild the tag table at startup even when no migration requires it.
         */
        private boolean rebuildTags = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBackfillFetchSize() {
            return backfillFetchSize;
        }

        public void setBackfillFetchSize(int backfillFetchSize) {
            this.backfillFetchSize = backfillFetchSize;
        }

        public long getProgressLogInterval() {
            return progressLogInterval;
        }

        public void setProgressLogInterval(long progressLogInterval) {
            this.progressLogInterval = progressLogInterval;
        }

        public boolean isRebuildTags() {
            return rebuildTags;
        }

        public void setRebuildTags(boolean rebuildTags) {
            this.rebuildTags = rebuildTags;
        }
    }

    public static class Metrics {
        /**
         * Whether to export metrics through Micrometer when it is on the classpath.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "relaydb";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
