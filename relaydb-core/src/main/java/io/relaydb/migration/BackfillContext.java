package io.relaydb.migration;

import io.relaydb.spi.ConnectionProvider;
import io.relaydb.spi.MetricsExporter;
import io.relaydb.spi.ProgressListener;

import java.util.Objects;

/**
 * Resources handed to a {@link Backfill} by the migration runner.
 *
 * @param connectionProvider source of the read and write connections
 * @param progress           progress side channel
 * @param metrics            metrics sink
 * @param fetchSize          rows fetched per round-trip while streaming
 */
public record BackfillContext(
        ConnectionProvider connectionProvider,
        ProgressListener progress,
        MetricsExporter metrics,
        int fetchSize
) {

    public BackfillContext {
        Objects.requireNonNull(connectionProvider, "connectionProvider");
        Objects.requireNonNull(progress, "progress");
        Objects.requireNonNull(metrics, "metrics");
        if (fetchSize <= 0) {
            throw new IllegalArgumentException("fetchSize must be > 0");
        }
    }
}
