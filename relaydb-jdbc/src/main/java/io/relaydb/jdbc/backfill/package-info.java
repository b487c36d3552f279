/**
 * Backfills that rewrite existing rows after a representation change.
 *
 * @see io.relaydb.jdbc.backfill.TagRebuilder
 */
package io.relaydb.jdbc.backfill;
