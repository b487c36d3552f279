package io.relaydb.jdbc.migration;

import io.relaydb.jdbc.RelayStoreException;
import io.relaydb.jdbc.spi.Dialect;
import io.relaydb.jdbc.tx.JdbcTransactionManager;
import io.relaydb.migration.Backfill;
import io.relaydb.migration.BackfillContext;
import io.relaydb.migration.Migration;
import io.relaydb.migration.MigrationException;
import io.relaydb.migration.MigrationRegistry;
import io.relaydb.migration.MigrationResult;
import io.relaydb.spi.ConnectionProvider;
import io.relaydb.spi.MetricsExporter;
import io.relaydb.spi.ProgressListener;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings a database up to the latest schema version of a {@link MigrationRegistry}.
 *
 * <p>Each pending migration runs in its own transaction together with the insert of
 * its ledger row, so a migration is either fully applied and recorded or not at all.
 * Migrations are applied in ascending serial-number order and never twice. The first
 * failure stops the upgrade: later migrations may depend on the failed one.
 *
 * <p>A migration that carries a {@link Backfill} has it run right after its own commit,
 * and only by the run that applied it.
 *
 * <pre>{@code
 * MigrationRunner runner = MigrationRunner.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .dialect(Dialects.detect(dataSource))
 *     .progressListener(new LoggingProgressListener())
 *     .build();
 * long version = runner.upgrade();
 * }</pre>
 *
 * <p>Intended to run once at startup, from a single thread.
 *
 * @see VersionLedger
 */
public final class MigrationRunner {
  private static final Logger logger = Logger.getLogger(MigrationRunner.class.getName());

  /** Default number of rows fetched per round-trip by backfills. */
  public static final int DEFAULT_BACKFILL_FETCH_SIZE = 1000;

  private final ConnectionProvider connectionProvider;
  private final MigrationRegistry registry;
  private final VersionLedger ledger;
  private final JdbcTransactionManager txManager;
  private final MetricsExporter metrics;
  private final ProgressListener progress;
  private final int backfillFetchSize;

  private MigrationRunner(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.registry = Objects.requireNonNull(builder.registry, "registry (or dialect)");
    if (builder.backfillFetchSize <= 0) {
      throw new IllegalArgumentException("backfillFetchSize must be > 0");
    }
    this.ledger = builder.ledger != null ? builder.ledger : new VersionLedger();
    this.txManager = new JdbcTransactionManager(connectionProvider);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.progress = builder.progress != null ? builder.progress : ProgressListener.NOOP;
    this.backfillFetchSize = builder.backfillFetchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public MigrationRegistry registry() {
    return registry;
  }

  /**
   * Creates the ledger table if absent. Safe to call on every startup.
   *
   * @throws RelayStoreException if the table cannot be created
   */
  public void ensureLedger() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      ledger.ensureExists(conn);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to create migration ledger", e);
    }
  }

  /**
   * Applies every pending migration in order and returns the resulting schema version.
   *
   * @return the highest serial number recorded in the ledger
   * @throws MigrationException if a migration or backfill fails, or if the database
   *     records a newer schema version than this registry knows
   */
  public long upgrade() {
    long start = System.nanoTime();
    ensureLedger();
    int applied = 0;
    for (Migration migration : registry.all()) {
      if (apply(migration) != MigrationResult.UPGRADED) {
        continue;
      }
      applied++;
      migration.backfill().ifPresent(backfill -> runBackfill(migration, backfill));
    }

    long version = currentVersion();
    if (version != registry.latestVersion()) {
      throw new MigrationException(version, "Database schema version " + version +
          " does not match the latest known migration " + registry.latestVersion());
    }
    metrics.recordSchemaVersion(version);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    int appliedCount = applied;
    logger.info(() -> "Schema at version " + version + " (" + appliedCount + " migration(s) applied in "
        + elapsedMs + " ms)");
    return version;
  }

  /**
   * Applies one migration unless the ledger already records it. Does not run its backfill.
   *
   * @throws MigrationException if the migration fails; the ledger is left unchanged
   */
  public MigrationResult apply(Migration migration) {
    Objects.requireNonNull(migration, "migration");
    long serial = migration.serialNumber();
    if (isApplied(serial)) {
      metrics.incrementMigrationSkipped();
      logger.fine(() -> "Migration " + serial + " already applied");
      return MigrationResult.NOT_NEEDED;
    }

    long start = System.nanoTime();
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      migration.apply(tx.connection());
      ledger.record(tx.connection(), serial);
      tx.commit();
    } catch (SQLException | RuntimeException e) {
      metrics.incrementMigrationFailed();
      logger.log(Level.SEVERE, "Migration " + serial + " (" + migration.description() + ") failed", e);
      throw new MigrationException(serial, "Migration " + serial + " failed: " + migration.description(), e);
    }

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    metrics.incrementMigrationApplied();
    metrics.recordMigrationDurationMs(elapsedMs);
    logger.info(() -> "Applied migration " + serial + " (" + migration.description() + ") in " + elapsedMs + " ms");
    return MigrationResult.UPGRADED;
  }

  /**
   * Runs the backfill of an already-applied migration again. Used to recover after a
   * backfill failed once its migration had been committed.
   *
   * @throws IllegalArgumentException if the migration is unknown or has no backfill
   * @throws MigrationException if the migration is not applied yet, or the backfill fails
   */
  public void runBackfill(long serialNumber) {
    Migration migration = registry.find(serialNumber)
        .orElseThrow(() -> new IllegalArgumentException("Unknown migration: " + serialNumber));
    Backfill backfill = migration.backfill()
        .orElseThrow(() -> new IllegalArgumentException("Migration " + serialNumber + " has no backfill"));
    if (!isApplied(serialNumber)) {
      throw new MigrationException(serialNumber,
          "Migration " + serialNumber + " must be applied before its backfill can run");
    }
    runBackfill(migration, backfill);
  }

  private void runBackfill(Migration migration, Backfill backfill) {
    long serial = migration.serialNumber();
    logger.info(() -> "Running backfill '" + backfill.name() + "' for migration " + serial);
    BackfillContext context = new BackfillContext(connectionProvider, progress, metrics, backfillFetchSize);
    try {
      backfill.run(context);
    } catch (SQLException | RuntimeException e) {
      metrics.incrementMigrationFailed();
      logger.log(Level.SEVERE, "Backfill '" + backfill.name() + "' for migration " + serial + " failed", e);
      throw new MigrationException(serial,
          "Backfill '" + backfill.name() + "' for migration " + serial + " failed", e);
    }
  }

  /**
   * Highest serial number recorded in the ledger, or {@code 0}.
   */
  public long currentVersion() {
    try (Connection conn = connectionProvider.getConnection()) {
      return ledger.currentVersion(conn);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to read schema version", e);
    }
  }

  /**
   * Registered migrations that the ledger does not record yet, in application order.
   */
  public List<Migration> pendingMigrations() {
    Set<Long> applied;
    try (Connection conn = connectionProvider.getConnection()) {
      applied = new HashSet<>(ledger.appliedVersions(conn));
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to read migration ledger", e);
    }
    return registry.all().stream()
        .filter(m -> !applied.contains(m.serialNumber()))
        .toList();
  }

  private boolean isApplied(long serialNumber) {
    try (Connection conn = connectionProvider.getConnection()) {
      return ledger.isApplied(conn, serialNumber);
    } catch (SQLException | RuntimeException e) {
      throw new MigrationException(serialNumber, "Failed to read ledger for migration " + serialNumber, e);
    }
  }

  /**
   * Builder for {@link MigrationRunner}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private MigrationRegistry registry;
    private VersionLedger ledger;
    private MetricsExporter metrics;
    private ProgressListener progress;
    private int backfillFetchSize = DEFAULT_BACKFILL_FETCH_SIZE;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Uses the dialect's relay schema catalog.
     */
    public Builder dialect(Dialect dialect) {
      this.registry = Objects.requireNonNull(dialect, "dialect").migrations();
      return this;
    }

    public Builder registry(MigrationRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder ledger(VersionLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder progressListener(ProgressListener progress) {
      this.progress = progress;
      return this;
    }

    public Builder backfillFetchSize(int backfillFetchSize) {
      this.backfillFetchSize = backfillFetchSize;
      return this;
    }

    public MigrationRunner build() {
      return new MigrationRunner(this);
    }
  }
}
