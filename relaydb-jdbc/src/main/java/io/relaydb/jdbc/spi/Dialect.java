package io.relaydb.jdbc.spi;

import io.relaydb.migration.MigrationRegistry;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>A dialect owns the migration catalog written in its SQL flavour and the
 * database-specific statements of the tag rebuild.
 * Register custom dialects via {@code META-INF/services/io.relaydb.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see io.relaydb.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * The relay schema migrations, in this dialect's SQL.
   */
  MigrationRegistry migrations();

  /**
   * Conflict-tolerant insert of a verbatim tag value. Inserting a row that already
   * exists must be a no-op, not an error.
   *
   * <p>Parameters: event_id (bytes), name (String), value (bytes)
   */
  String insertTagValueSql();

  /**
   * Conflict-tolerant insert of a hex-packed tag value.
   *
   * <p>Parameters: event_id (bytes), name (String), value_hex (bytes)
   */
  String insertTagHexSql();
}
