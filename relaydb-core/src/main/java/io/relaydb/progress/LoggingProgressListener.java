package io.relaydb.progress;

import io.relaydb.spi.ProgressListener;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ProgressListener} that writes progress lines to {@code java.util.logging}.
 *
 * <p>Logs when a task starts, every {@code interval} processed units, and on completion:
 * <pre>
 * rebuilding tags table: 20000/51234 [39%]
 * </pre>
 */
public final class LoggingProgressListener implements ProgressListener {
    private static final Logger logger = Logger.getLogger(LoggingProgressListener.class.getName());

    /** Default number of units between two progress lines. */
    public static final long DEFAULT_INTERVAL = 10_000;

    private final long interval;
    private final Level level;

    public LoggingProgressListener() {
        this(DEFAULT_INTERVAL);
    }

    public LoggingProgressListener(long interval) {
        this(interval, Level.INFO);
    }

    public LoggingProgressListener(long interval, Level level) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.interval = interval;
        this.level = Objects.requireNonNull(level, "level");
    }

    @Override
    public void started(String task, long total) {
        logger.log(level, () -> task + ": 0/" + total);
    }

    @Override
    public void advanced(String task, long processed, long total) {
        if (processed % interval != 0) {
            return;
        }
        logger.log(level, () -> task + ": " + processed + "/" + total + " [" + percent(processed, total) + "%]");
    }

    @Override
    public void completed(String task, long processed, Duration elapsed) {
        logger.log(level, () -> task + ": done, " + processed + " processed in " + elapsed.toMillis() + " ms");
    }

    static long percent(long processed, long total) {
        if (total <= 0) {
            return 100;
        }
        return Math.min(100, processed * 100 / total);
    }
}
