package io.relaydb.jdbc.dialect;

import io.relaydb.jdbc.migration.PostgresMigrations;
import io.relaydb.migration.MigrationRegistry;

import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {
  private final MigrationRegistry migrations = PostgresMigrations.registry(this);

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public MigrationRegistry migrations() {
    return migrations;
  }
}
