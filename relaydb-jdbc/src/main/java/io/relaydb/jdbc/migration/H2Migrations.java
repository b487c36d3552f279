package io.relaydb.jdbc.migration;

import io.relaydb.jdbc.backfill.TagRebuilder;
import io.relaydb.jdbc.spi.Dialect;
import io.relaydb.migration.MigrationRegistry;
import io.relaydb.migration.SchemaVersion;
import io.relaydb.migration.SqlMigration;

/**
 * Relay schema history for H2, mirroring {@link PostgresMigrations} serial for serial.
 * Append only.
 */
public final class H2Migrations {

  private H2Migrations() {
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
        "CREATE TABLE event (" +
            "id VARBINARY NOT NULL, " +
            "pub_key VARBINARY NOT NULL, " +
            "created_at TIMESTAMP WITH TIME ZONE NOT NULL, " +
            "kind INTEGER NOT NULL, " +
            "\"content\" VARBINARY NOT NULL, " +
            "hidden BOOLEAN DEFAULT FALSE NOT NULL, " +
            "delegated_by VARBINARY, " +
            "first_seen TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL, " +
            "CONSTRAINT event_pkey PRIMARY KEY (id)" +
            ")",
        "CREATE INDEX event_created_at_idx ON event (created_at, kind)",
        "CREATE INDEX event_pub_key_idx ON event (pub_key)",
        "CREATE INDEX event_delegated_by_idx ON event (delegated_by)",
        "CREATE TABLE tag (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY, " +
            "event_id VARBINARY NOT NULL, " +
            "\"name\" VARCHAR NOT NULL, " +
            "\"value\" VARBINARY NOT NULL, " +
            "CONSTRAINT tag_fk FOREIGN KEY (event_id) REFERENCES event (id) ON DELETE CASCADE" +
            ")",
        "CREATE INDEX tag_event_id_idx ON tag (event_id, \"name\")",
        "CREATE INDEX tag_value_idx ON tag (\"value\")",
        "CREATE TABLE user_verification (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY, " +
            "event_id VARBINARY NOT NULL, " +
            "\"name\" VARCHAR NOT NULL, " +
            "verified_at TIMESTAMP WITH TIME ZONE, " +
            "failed_at TIMESTAMP WITH TIME ZONE, " +
            "fail_count INTEGER DEFAULT 0, " +
            "CONSTRAINT user_verification_pk PRIMARY KEY (id), " +
            "CONSTRAINT user_verification_fk FOREIGN KEY (event_id) REFERENCES event (id) ON DELETE CASCADE" +
            ")",
        "CREATE INDEX user_verification_event_id_idx ON user_verification (event_id)",
        "CREATE INDEX user_verification_name_idx ON user_verification (\"name\")");
  }

  static SqlMigration tagValueHex() {
    return SqlMigration.of(SchemaVersion.TAG_VALUE_HEX, "store hex tag values as bytes",
        "ALTER TABLE tag ADD COLUMN value_hex VARBINARY",
        "ALTER TABLE tag ALTER COLUMN \"value\" DROP NOT NULL",
        "CREATE INDEX tag_value_hex_idx ON tag (value_hex)");
  }

  static SqlMigration tagUnique() {
    return SqlMigration.of(SchemaVersion.TAG_UNIQUE, "unique tags per event",
        "ALTER TABLE tag ADD CONSTRAINT unique_constraint_name UNIQUE (event_id, \"name\", \"value\")");
  }

  // H2 has no CREATE TYPE ... AS ENUM; a check constraint keeps the same value set.
  static SqlMigration accountsAndInvoices() {
    return SqlMigration.of(SchemaVersion.ACCOUNTS_AND_INVOICES, "create account and invoice tables",
        "CREATE TABLE account (" +
            "pubkey VARCHAR NOT NULL, " +
            "is_admitted BOOLEAN DEFAULT FALSE NOT NULL, " +
            "balance BIGINT DEFAULT 0 NOT NULL, " +
            "tos_accepted_at TIMESTAMP, " +
            "CONSTRAINT account_pkey PRIMARY KEY (pubkey)" +
            ")",
        "CREATE TABLE invoice (" +
            "payment_hash VARCHAR NOT NULL, " +
            "pubkey VARCHAR NOT NULL, " +
            "amount BIGINT NOT NULL, " +
            "status VARCHAR(7) DEFAULT 'Unpaid' NOT NULL, " +
            "description VARCHAR, " +
            "confirmed_at TIMESTAMP, " +
            "created_at TIMESTAMP, " +
            "invoice VARCHAR, " +
            "CONSTRAINT invoice_payment_hash PRIMARY KEY (payment_hash), " +
            "CONSTRAINT invoice_status_check CHECK (status IN ('Paid', 'Unpaid', 'Expired')), " +
            "CONSTRAINT invoice_pubkey_fkey FOREIGN KEY (pubkey) REFERENCES account (pubkey) ON DELETE CASCADE" +
            ")");
  }
}
