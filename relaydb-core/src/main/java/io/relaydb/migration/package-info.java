/**
 * Migration model: descriptors, the ordered registry, backfills and results.
 *
 * <p>Applying migrations against a database is done by
 * {@code io.relaydb.jdbc.migration.MigrationRunner}.
 */
package io.relaydb.migration;
