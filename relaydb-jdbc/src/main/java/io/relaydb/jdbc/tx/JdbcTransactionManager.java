package io.relaydb.jdbc.tx;

import io.relaydb.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit and hands it out through a {@link Transaction} scope.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     migration.apply(tx.connection());
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>Several scopes may be open on one thread at the same time; each owns its
 * own connection.
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new read-write transaction.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    return open(false);
  }

  /**
   * Begins a transaction flagged read-only, for long-running cursors.
   */
  public Transaction beginReadOnly() throws SQLException {
    return open(true);
  }

  private Transaction open(boolean readOnly) throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      if (readOnly) {
        connection.setReadOnly(true);
      }
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection, readOnly);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final boolean readOnly;
    private boolean completed;

    private Transaction(Connection connection, boolean readOnly) {
      this.connection = connection;
      this.readOnly = readOnly;
    }

    /**
     * The transaction's connection. Do not commit, roll back or close it directly.
     */
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    public boolean isCompleted() {
      return completed;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        rollbackAfter(e);
        finalizeTx(e);
        throw e;
      }
      finalizeTx(null);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        finalizeTx(e);
        throw e;
      }
      finalizeTx(null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void rollbackAfter(SQLException failure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        failure.addSuppressed(e);
      }
    }

    /**
     * Restores the connection defaults and releases it. When {@code failure} is set,
     * cleanup errors are attached to it instead of being thrown.
     */
    private void finalizeTx(SQLException failure) throws SQLException {
      completed = true;
      SQLException cleanup = null;
      try {
        if (readOnly) {
          connection.setReadOnly(false);
        }
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        cleanup = e;
      }
      try {
        connection.close();
      } catch (SQLException e) {
        if (cleanup == null) cleanup = e;
        else cleanup.addSuppressed(e);
      }
      if (cleanup == null) {
        return;
      }
      if (failure != null) {
        failure.addSuppressed(cleanup);
        return;
      }
      throw cleanup;
    }
  }
}
