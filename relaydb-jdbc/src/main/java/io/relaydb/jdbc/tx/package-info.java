/**
 * Manual JDBC transaction management.
 *
 * <p>{@link io.relaydb.jdbc.tx.JdbcTransactionManager} provides a try-with-resources
 * API with guaranteed commit-or-rollback on every exit path.
 */
package io.relaydb.jdbc.tx;
