package io.relaydb.migration;

/**
 * Serial numbers of the relay schema migrations. Shared by every dialect's catalog.
 */
public final class SchemaVersion {

    /** Event, tag and NIP-05 verification tables. */
    public static final long EVENTS_AND_TAGS = 1;

    /** Hex-packed tag values; requires a tag rebuild. */
    public static final long TAG_VALUE_HEX = 2;

    /** Unique tags per event. */
    public static final long TAG_UNIQUE = 3;

    /** Pay-to-relay accounts and invoices. */
    public static final long ACCOUNTS_AND_INVOICES = 4;

    private SchemaVersion() {
    }
}
