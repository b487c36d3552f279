package io.relaydb.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {

  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = TestDatabases.h2("template");
    try (Connection conn = dataSource.getConnection()) {
      TestDatabases.execute(conn, "CREATE TABLE item (id BIGINT PRIMARY KEY, payload VARBINARY)");
    }
  }

  @Test
  void updateBindsLongAndBytes() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      int inserted = JdbcTemplate.update(conn, "INSERT INTO item (id, payload) VALUES (?, ?)",
          42L, new byte[]{1, 2, 3});

      assertEquals(1, inserted);
      List<byte[]> payloads = JdbcTemplate.query(conn, "SELECT payload FROM item WHERE id = ?",
          rs -> rs.getBytes(1), 42L);
      assertArrayEquals(new byte[]{1, 2, 3}, payloads.get(0));
    }
  }

  @Test
  void queryForLongReadsNullAsZero() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0L, JdbcTemplate.queryForLong(conn, "SELECT MAX(id) FROM item"));
      JdbcTemplate.update(conn, "INSERT INTO item (id) VALUES (?)", 7L);
      assertEquals(7L, JdbcTemplate.queryForLong(conn, "SELECT MAX(id) FROM item"));
    }
  }

  @Test
  void streamVisitsRowsInOrder() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      for (long id = 5; id >= 1; id--) {
        JdbcTemplate.update(conn, "INSERT INTO item (id) VALUES (?)", id);
      }
      conn.setAutoCommit(false);
      List<Long> seen = new ArrayList<>();

      long rows = JdbcTemplate.stream(conn, "SELECT id FROM item ORDER BY id", 2, rs -> seen.add(rs.getLong(1)));
      conn.rollback();

      assertEquals(5, rows);
      assertEquals(List.of(1L, 2L, 3L, 4L, 5L), seen);
    }
  }

  @Test
  void wrapsSqlExceptions() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      RelayStoreException ex = assertThrows(RelayStoreException.class,
          () -> JdbcTemplate.update(conn, "INSERT INTO missing_table (id) VALUES (?)", 1L));
      assertInstanceOf(SQLException.class, ex.getCause());

      assertThrows(RelayStoreException.class, () -> JdbcTemplate.execute(conn, "NOT SQL"));
    }
  }

  @Test
  void callbackExceptionsPropagateUnchanged() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      JdbcTemplate.update(conn, "INSERT INTO item (id) VALUES (?)", 1L);

      IllegalStateException ex = assertThrows(IllegalStateException.class,
          () -> JdbcTemplate.stream(conn, "SELECT id FROM item", 10, rs -> {
            throw new IllegalStateException("boom");
          }));
      assertEquals("boom", ex.getMessage());
    }
  }
}
