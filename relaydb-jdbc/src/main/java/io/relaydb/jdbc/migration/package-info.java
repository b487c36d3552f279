/**
 * Schema upgrades: the {@link io.relaydb.jdbc.migration.VersionLedger}, the
 * {@link io.relaydb.jdbc.migration.MigrationRunner} and the per-dialect relay schema
 * catalogs ({@link io.relaydb.jdbc.migration.PostgresMigrations},
 * {@link io.relaydb.jdbc.migration.H2Migrations}).
 */
package io.relaydb.jdbc.migration;
