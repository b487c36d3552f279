package io.relaydb.jdbc.dialect;

import io.relaydb.jdbc.migration.H2Migrations;
import io.relaydb.migration.MigrationRegistry;

import java.util.List;

/**
 * H2 dialect, for embedded deployments and tests.
 *
 * <p>H2 commits DDL implicitly, so a failing multi-statement schema migration can
 * leave earlier statements applied. The ledger entry is still only written on
 * success, so the migration is retried, but the retry may then fail on the
 * already-applied statements.
 */
public final class H2Dialect extends AbstractDialect {
  private final MigrationRegistry migrations = H2Migrations.registry(this);

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public MigrationRegistry migrations() {
    return migrations;
  }

  @Override
  public String insertTagValueSql() {
    return "MERGE INTO tag (event_id, \"name\", \"value\") KEY (event_id, \"name\", \"value\") VALUES (?, ?, ?)";
  }

  @Override
  public String insertTagHexSql() {
    return "MERGE INTO tag (event_id, \"name\", value_hex) KEY (event_id, \"name\", value_hex) VALUES (?, ?, ?)";
  }
}
