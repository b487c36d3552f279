package io.relaydb.spi;

import java.time.Duration;

/**
 * Operator-facing progress side channel for long running backfills.
 *
 * <p>Callbacks are informational only. Implementations must not throw; callers
 * treat any exception raised here as a logging problem and carry on.
 *
 * @see io.relaydb.progress.LoggingProgressListener
 */
public interface ProgressListener {

    /**
     * Listener that ignores every callback. Suitable for headless runs and tests.
     */
    ProgressListener NOOP = new ProgressListener() {
    };

    /**
     * Called once before the first unit is processed.
     *
     * @param task  short description of the work, e.g. {@code "rebuilding tags table"}
     * @param total number of units expected
     */
    default void started(String task, long total) {
    }

    /**
     * Called after each processed unit.
     *
     * @param task      the task name passed to {@link #started}
     * @param processed units processed so far
     * @param total     units expected
     */
    default void advanced(String task, long processed, long total) {
    }

    /**
     * Called once after the work has been committed.
     */
    default void completed(String task, long processed, Duration elapsed) {
    }
}
