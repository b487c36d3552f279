package io.relaydb.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and the
 * ledger and backfill code built on it.
 */
public final class RelayStoreException extends RuntimeException {
  public RelayStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
