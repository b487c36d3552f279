package io.relaydb.jdbc.migration;

import io.relaydb.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * Durable record of applied migrations: one row per serial number in the
 * {@code migrations} table. The highest serial number is the schema version.
 *
 * <p>Nothing is cached; every call reads the table.
 */
public final class VersionLedger {
  public static final String DEFAULT_TABLE = "migrations";

  private final String tableName;

  public VersionLedger() {
    this(DEFAULT_TABLE);
  }

  public VersionLedger(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  public String tableName() {
    return tableName;
  }

  /**
   * Creates the ledger table if it does not exist yet. The primary key rejects a
   * second insert of the same serial number.
   */
  public void ensureExists(Connection conn) {
    JdbcTemplate.execute(conn, "CREATE TABLE IF NOT EXISTS " + tableName +
        " (serial_number BIGINT NOT NULL, CONSTRAINT " + tableName + "_pkey PRIMARY KEY (serial_number))");
  }

  public boolean isApplied(Connection conn, long serialNumber) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE serial_number = ?", serialNumber) > 0;
  }

  /**
   * Records a migration. Call inside the migration's own transaction.
   */
  public void record(Connection conn, long serialNumber) {
    JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (serial_number) VALUES (?)", serialNumber);
  }

  /**
   * Highest applied serial number, or {@code 0} when nothing has been applied.
   */
  public long currentVersion(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT MAX(serial_number) FROM " + tableName);
  }

  public List<Long> appliedVersions(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT serial_number FROM " + tableName + " ORDER BY serial_number",
        rs -> rs.getLong(1));
  }
}
