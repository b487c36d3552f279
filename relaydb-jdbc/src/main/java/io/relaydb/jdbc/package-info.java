/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.relaydb.jdbc.JdbcTemplate} provides lightweight JDBC helpers.
 * {@link io.relaydb.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.relaydb.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.relaydb.jdbc.tx}: scoped transactions</li>
 *   <li>{@code io.relaydb.jdbc.dialect}: PostgreSQL and H2 dialects and auto-detection</li>
 *   <li>{@code io.relaydb.jdbc.migration}: version ledger, migration runner and catalogs</li>
 *   <li>{@code io.relaydb.jdbc.backfill}: tag table rebuild</li>
 * </ul>
 */
package io.relaydb.jdbc;
