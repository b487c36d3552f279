package io.relaydb.jdbc.migration;

import io.relaydb.jdbc.DataSourceConnectionProvider;
import io.relaydb.jdbc.JdbcTemplate;
import io.relaydb.jdbc.TestDatabases;
import io.relaydb.migration.Backfill;
import io.relaydb.migration.BackfillContext;
import io.relaydb.migration.Migration;
import io.relaydb.migration.MigrationException;
import io.relaydb.migration.MigrationRegistry;
import io.relaydb.migration.MigrationResult;
import io.relaydb.migration.ProceduralMigration;
import io.relaydb.migration.SqlMigration;
import io.relaydb.spi.MetricsExporter;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MigrationRunnerTest {

  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabases.h2("runner");
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    metrics = new RecordingMetrics();
    try (Connection conn = dataSource.getConnection()) {
      TestDatabases.execute(conn, "CREATE TABLE applied_log (id BIGINT GENERATED BY DEFAULT AS IDENTITY, serial BIGINT)");
    }
  }

  @Test
  void builderRequiresConnectionProviderAndRegistry() {
    assertThrows(NullPointerException.class, () -> MigrationRunner.builder()
        .registry(registry(1, 2)).build());
    assertThrows(NullPointerException.class, () -> MigrationRunner.builder()
        .connectionProvider(connectionProvider).build());
    assertThrows(IllegalArgumentException.class, () -> MigrationRunner.builder()
        .connectionProvider(connectionProvider)
        .registry(registry(1))
        .backfillFetchSize(0)
        .build());
  }

  @Test
  void upgradeAppliesAllInOrder() {
    MigrationRunner runner = runner(registry(1, 2, 5));

    assertEquals(5L, runner.upgrade());
    assertEquals(List.of(1L, 2L, 5L), appliedLog());
    assertEquals(3, metrics.applied);
    assertEquals(5L, metrics.schemaVersion);
    assertEquals(3, metrics.durations.size());
  }

  @Test
  void upgradeIsIdempotent() {
    MigrationRunner runner = runner(registry(1, 2, 3));
    runner.upgrade();

    assertEquals(3L, runner.upgrade());
    assertEquals(List.of(1L, 2L, 3L), appliedLog());
    assertEquals(3, metrics.applied);
    assertEquals(3, metrics.skipped);
    assertTrue(runner.pendingMigrations().isEmpty());
  }

  @Test
  void appliesOnlyMissingVersionsWhenLedgerHasGaps() throws SQLException {
    MigrationRunner runner = runner(registry(1, 2, 3, 4));
    runner.ensureLedger();
    try (Connection conn = dataSource.getConnection()) {
      VersionLedger ledger = new VersionLedger();
      ledger.record(conn, 1);
      ledger.record(conn, 3);
    }

    assertEquals(List.of(2L, 4L), runner.pendingMigrations().stream().map(Migration::serialNumber).toList());
    assertEquals(4L, runner.upgrade());
    assertEquals(List.of(2L, 4L), appliedLog());
  }

  @Test
  void applyReportsNotNeededForRecordedMigration() {
    Migration first = logging(1);
    MigrationRunner runner = runner(MigrationRegistry.of(first));
    runner.ensureLedger();

    assertEquals(MigrationResult.UPGRADED, runner.apply(first));
    assertEquals(MigrationResult.NOT_NEEDED, runner.apply(first));
    assertEquals(List.of(1L), appliedLog());
  }

  @Test
  void failingStatementLeavesDataAndLedgerUntouched() {
    Migration broken = SqlMigration.of(2, "half broken",
        "INSERT INTO applied_log (serial) VALUES (2)",
        "INSERT INTO no_such_table (serial) VALUES (2)");
    MigrationRunner runner = runner(MigrationRegistry.of(logging(1), broken, logging(3)));

    MigrationException ex = assertThrows(MigrationException.class, runner::upgrade);

    assertEquals(2L, ex.serialNumber());
    assertNotNull(ex.getCause());
    assertEquals(List.of(1L), appliedLog());
    assertEquals(1L, runner.currentVersion());
    assertEquals(1, metrics.failed);
  }

  @Test
  void failureHaltsLaterMigrations() {
    AtomicInteger laterCalls = new AtomicInteger();
    Migration failing = ProceduralMigration.of(1, "fails", conn -> {
      throw new SQLException("boom");
    });
    Migration later = ProceduralMigration.of(2, "later", conn -> laterCalls.incrementAndGet());
    MigrationRunner runner = runner(MigrationRegistry.of(failing, later));

    MigrationException ex = assertThrows(MigrationException.class, runner::upgrade);

    assertEquals(1L, ex.serialNumber());
    assertEquals("boom", ex.getCause().getMessage());
    assertEquals(0, laterCalls.get());
    assertEquals(0L, runner.currentVersion());
  }

  @Test
  void proceduralMigrationReceivesTransactionConnection() {
    Migration procedural = ProceduralMigration.of(1, "procedural", conn -> {
      assertFalse(conn.getAutoCommit());
      JdbcTemplate.update(conn, "INSERT INTO applied_log (serial) VALUES (?)", 11L);
    });
    MigrationRunner runner = runner(MigrationRegistry.of(procedural));

    assertEquals(1L, runner.upgrade());
    assertEquals(List.of(11L), appliedLog());
  }

  @Test
  void backfillRunsOnlyWhenMigrationWasApplied() {
    CountingBackfill backfill = new CountingBackfill();
    MigrationRegistry registry = MigrationRegistry.of(logging(1), logging(2).withBackfill(backfill), logging(3));
    MigrationRunner runner = MigrationRunner.builder()
        .connectionProvider(connectionProvider)
        .registry(registry)
        .backfillFetchSize(50)
        .build();

    runner.upgrade();
    runner.upgrade();

    assertEquals(1, backfill.runs);
    assertEquals(50, backfill.lastContext.fetchSize());
    assertEquals(List.of(2L), backfill.versionSeen);
  }

  @Test
  void failedBackfillKeepsMigrationAndCanBeRerun() {
    CountingBackfill backfill = new CountingBackfill();
    backfill.failuresLeft = 1;
    MigrationRunner runner = runner(MigrationRegistry.of(logging(1).withBackfill(backfill), logging(2)));

    MigrationException ex = assertThrows(MigrationException.class, runner::upgrade);
    assertEquals(1L, ex.serialNumber());
    assertEquals(1L, runner.currentVersion());
    assertEquals(1, metrics.failed);

    runner.runBackfill(1);
    assertEquals(2, backfill.runs);
  }

  @Test
  void runBackfillValidatesTarget() {
    CountingBackfill backfill = new CountingBackfill();
    MigrationRunner runner = runner(MigrationRegistry.of(logging(1), logging(2).withBackfill(backfill)));
    runner.ensureLedger();

    assertThrows(IllegalArgumentException.class, () -> runner.runBackfill(9));
    assertThrows(IllegalArgumentException.class, () -> runner.runBackfill(1));
    MigrationException ex = assertThrows(MigrationException.class, () -> runner.runBackfill(2));
    assertEquals(2L, ex.serialNumber());
    assertEquals(0, backfill.runs);
  }

  @Test
  void databaseNewerThanRegistryFails() throws SQLException {
    MigrationRunner runner = runner(registry(1, 2));
    runner.upgrade();
    try (Connection conn = dataSource.getConnection()) {
      new VersionLedger().record(conn, 3);
    }

    MigrationException ex = assertThrows(MigrationException.class, runner::upgrade);
    assertEquals(3L, ex.serialNumber());
  }

  @Test
  void emptyRegistryLeavesVersionZero() {
    assertEquals(0L, runner(MigrationRegistry.of()).upgrade());
  }

  private MigrationRunner runner(MigrationRegistry registry) {
    return MigrationRunner.builder()
        .connectionProvider(connectionProvider)
        .registry(registry)
        .metrics(metrics)
        .build();
  }

  private static MigrationRegistry registry(long... serials) {
    List<Migration> migrations = new ArrayList<>();
    for (long serial : serials) {
      migrations.add(logging(serial));
    }
    return MigrationRegistry.of(migrations);
  }

  private static SqlMigration logging(long serial) {
    return SqlMigration.of(serial, "log " + serial, "INSERT INTO applied_log (serial) VALUES (" + serial + ")");
  }

  private List<Long> appliedLog() {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.query(conn, "SELECT serial FROM applied_log ORDER BY id", rs -> rs.getLong(1));
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  private static final class CountingBackfill implements Backfill {
    int runs;
    int failuresLeft;
    BackfillContext lastContext;
    final List<Long> versionSeen = new ArrayList<>();

    @Override
    public String name() {
      return "counting";
    }

    @Override
    public void run(BackfillContext context) throws SQLException {
      runs++;
      lastContext = context;
      try (Connection conn = context.connectionProvider().getConnection()) {
        versionSeen.add(new VersionLedger().currentVersion(conn));
      }
      if (failuresLeft > 0) {
        failuresLeft--;
        throw new SQLException("backfill failed");
      }
    }
  }

  private static final class RecordingMetrics implements MetricsExporter {
    int applied;
    int skipped;
    int failed;
    long schemaVersion = -1;
    final List<Long> durations = new ArrayList<>();

    @Override
    public void incrementMigrationApplied() {
      applied++;
    }

    @Override
    public void incrementMigrationSkipped() {
      skipped++;
    }

    @Override
    public void incrementMigrationFailed() {
      failed++;
    }

    @Override
    public void recordMigrationDurationMs(long durationMs) {
      durations.add(durationMs);
    }

    @Override
    public void recordSchemaVersion(long version) {
      schemaVersion = version;
    }
  }
}
