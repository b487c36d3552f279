package io.relaydb.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * H2 databases and event/tag fixtures shared by the JDBC tests.
 */
public final class TestDatabases {

  private TestDatabases() {
  }

  public static JdbcDataSource h2(String label) {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + label + "_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    return dataSource;
  }

  public static void execute(Connection conn, String sql) throws SQLException {
    try (Statement statement = conn.createStatement()) {
      statement.execute(sql);
    }
  }

  public static long count(Connection conn, String sql) throws SQLException {
    try (Statement statement = conn.createStatement(); ResultSet rs = statement.executeQuery(sql)) {
      rs.next();
      return rs.getLong(1);
    }
  }

  public static boolean tableExists(Connection conn, String table) throws SQLException {
    try (ResultSet rs = conn.getMetaData().getTables(null, null, null, new String[]{"TABLE"})) {
      while (rs.next()) {
        if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
          return true;
        }
      }
      return false;
    }
  }

  public static void insertEvent(Connection conn, byte[] id, String content) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "INSERT INTO event (id, pub_key, created_at, kind, \"content\") VALUES (?, ?, ?, ?, ?)")) {
      ps.setBytes(1, id);
      ps.setBytes(2, new byte[]{7, 7, 7});
      ps.setObject(3, OffsetDateTime.of(2023, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
      ps.setInt(4, 1);
      ps.setBytes(5, content.getBytes(StandardCharsets.UTF_8));
      ps.executeUpdate();
    }
  }

  public static List<TagRow> tags(Connection conn) throws SQLException {
    List<TagRow> rows = new ArrayList<>();
    try (Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(
             "SELECT event_id, \"name\", \"value\", value_hex FROM tag ORDER BY event_id, \"name\", id")) {
      while (rs.next()) {
        rows.add(new TagRow(rs.getBytes(1), rs.getString(2), rs.getBytes(3), rs.getBytes(4)));
      }
    }
    return rows;
  }

  /**
   * One row of the tag table.
   */
  public record TagRow(byte[] eventId, String name, byte[] value, byte[] valueHex) {

    public String valueAsString() {
      return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }
  }
}
