package io.relaydb.jdbc.migration;

import io.relaydb.jdbc.backfill.TagRebuilder;
import io.relaydb.jdbc.spi.Dialect;
import io.relaydb.migration.MigrationRegistry;
import io.relaydb.migration.SchemaVersion;
import io.relaydb.migration.SqlMigration;

/**
 * Relay schema history for PostgreSQL. Append only.
 */
public final class PostgresMigrations {

  private PostgresMigrations() {
  }

  public static MigrationRegistry registry(Dialect dialect) {
    return MigrationRegistry.of(
        eventsAndTags(),
        tagValueHex().withBackfill(new TagRebuilder(dialect)),
        tagUnique(),
        accountsAndInvoices());
  }

  static SqlMigration eventsAndTags() {
    return SqlMigration.of(SchemaVersion.EVENTS_AND_TAGS, "create event, tag and user_verification tables",
        "CREATE TABLE \"event\" (" +
            "id bytea NOT NULL, " +
            "pub_key bytea NOT NULL, " +
            "created_at timestamp with time zone NOT NULL, " +
            "kind integer NOT NULL, " +
            "\"content\" bytea NOT NULL, " +
            "hidden bit(1) NOT NULL DEFAULT 0::bit(1), " +
            "delegated_by bytea NULL, " +
            "first_seen timestamp with time zone NOT NULL DEFAULT now(), " +
            "CONSTRAINT event_pkey PRIMARY KEY (id)" +
            ")",
        "CREATE INDEX event_created_at_idx ON \"event\" (created_at, kind)",
        "CREATE INDEX event_pub_key_idx ON \"event\" (pub_key)",
        "CREATE INDEX event_delegated_by_idx ON \"event\" (delegated_by)",
        "CREATE TABLE \"tag\" (" +
            "id int8 NOT NULL GENERATED BY DEFAULT AS IDENTITY, " +
            "event_id bytea NOT NULL, " +
            "\"name\" varchar NOT NULL, " +
            "\"value\" bytea NOT NULL, " +
            "CONSTRAINT tag_fk FOREIGN KEY (event_id) REFERENCES \"event\"(id) ON DELETE CASCADE" +
            ")",
        "CREATE INDEX tag_event_id_idx ON tag USING btree (event_id, \"name\")",
        "CREATE INDEX tag_value_idx ON tag USING btree (\"value\")",
        "CREATE TABLE \"user_verification\" (" +
            "id int8 NOT NULL GENERATED BY DEFAULT AS IDENTITY, " +
            "event_id bytea NOT NULL, " +
            "\"name\" varchar NOT NULL, " +
            "verified_at timestamptz NULL, " +
            "failed_at timestamptz NULL, " +
            "fail_count int4 NULL DEFAULT 0, " +
            "CONSTRAINT user_verification_pk PRIMARY KEY (id), " +
            "CONSTRAINT user_verification_fk FOREIGN KEY (event_id) REFERENCES \"event\"(id) ON DELETE CASCADE" +
            ")",
        "CREATE INDEX user_verification_event_id_idx ON user_verification USING btree (event_id)",
        "CREATE INDEX user_verification_name_idx ON user_verification USING btree (\"name\")");
  }

  static SqlMigration tagValueHex() {
    return SqlMigration.of(SchemaVersion.TAG_VALUE_HEX, "store hex tag values as bytes",
        "ALTER TABLE tag ADD COLUMN value_hex bytea",
        "ALTER TABLE tag ALTER COLUMN \"value\" DROP NOT NULL",
        "CREATE INDEX tag_value_hex_idx ON tag USING btree (value_hex)");
  }

  static SqlMigration tagUnique() {
    return SqlMigration.of(SchemaVersion.TAG_UNIQUE, "unique tags per event",
        "ALTER TABLE tag ADD CONSTRAINT unique_constraint_name UNIQUE (event_id, \"name\", \"value\")");
  }

  static SqlMigration accountsAndInvoices() {
    return SqlMigration.of(SchemaVersion.ACCOUNTS_AND_INVOICES, "create account and invoice tables",
        "CREATE TABLE \"account\" (" +
            "pubkey varchar NOT NULL, " +
            "is_admitted BOOLEAN NOT NULL DEFAULT FALSE, " +
            "balance BIGINT NOT NULL DEFAULT 0, " +
            "tos_accepted_at TIMESTAMP, " +
            "CONSTRAINT account_pkey PRIMARY KEY (pubkey)" +
            ")",
        "CREATE TYPE status AS ENUM ('Paid', 'Unpaid', 'Expired')",
        "CREATE TABLE \"invoice\" (" +
            "payment_hash varchar NOT NULL, " +
            "pubkey varchar NOT NULL, " +
            "amount BIGINT NOT NULL, " +
            "status status NOT NULL DEFAULT 'Unpaid', " +
            "description varchar, " +
            "confirmed_at timestamp, " +
            "created_at timestamp, " +
            "invoice varchar, " +
            "CONSTRAINT invoice_payment_hash PRIMARY KEY (payment_hash), " +
            "CONSTRAINT invoice_pubkey_fkey FOREIGN KEY (pubkey) REFERENCES account (pubkey) ON DELETE CASCADE" +
            ")");
  }
}
