package io.relaydb.jdbc.dialect;

import io.relaydb.jdbc.spi.Dialect;

/**
 * Base dialect with PostgreSQL-style {@code ON CONFLICT DO NOTHING} tag inserts.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String insertTagValueSql() {
    return "INSERT INTO tag (event_id, \"name\", \"value\") VALUES (?, ?, ?) ON CONFLICT DO NOTHING";
  }

  @Override
  public String insertTagHexSql() {
    return "INSERT INTO tag (event_id, \"name\", value_hex) VALUES (?, ?, ?) ON CONFLICT DO NOTHING";
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name() + "]";
  }
}
