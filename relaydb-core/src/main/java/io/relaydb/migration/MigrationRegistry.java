package io.relaydb.migration;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable catalog of the migrations known to this build.
 *
 * <p>Serial numbers must be positive and strictly increasing. Gaps are allowed.
 * New migrations are appended with a higher serial number; existing entries are
 * never edited or reordered.
 *
 * <pre>{@code
 * MigrationRegistry registry = MigrationRegistry.of(
 *     SqlMigration.of(1, "create event table", "CREATE TABLE event (...)"),
 *     SqlMigration.of(2, "add tag value_hex", "ALTER TABLE tag ADD COLUMN value_hex bytea")
 *         .withBackfill(tagRebuilder));
 * }</pre>
 */
public final class MigrationRegistry {
    private final List<Migration> migrations;

    private MigrationRegistry(List<Migration> migrations) {
        this.migrations = migrations;
    }

    /**
     * Creates a registry from migrations listed in ascending serial-number order.
     *
     * @throws IllegalArgumentException if the serial numbers are not strictly increasing
     */
    public static MigrationRegistry of(Migration... migrations) {
        return of(List.of(migrations));
    }

    public static MigrationRegistry of(List<? extends Migration> migrations) {
        Objects.requireNonNull(migrations, "migrations");
        long previous = 0;
        for (Migration migration : migrations) {
            Objects.requireNonNull(migration, "migration");
            if (migration.serialNumber() <= previous) {
                throw new IllegalArgumentException("Migration serial numbers must be strictly increasing: "
                        + migration.serialNumber() + " follows " + previous);
            }
            previous = migration.serialNumber();
        }
        return new MigrationRegistry(List.copyOf(migrations));
    }

    /**
     * All migrations in ascending serial-number order.
     */
    public List<Migration> all() {
        return migrations;
    }

    public Optional<Migration> find(long serialNumber) {
        return migrations.stream()
                .filter(m -> m.serialNumber() == serialNumber)
                .findFirst();
    }

    /**
     * Highest serial number in the catalog, or {@code 0} if it is empty.
     */
    public long latestVersion() {
        return migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).serialNumber();
    }

    public int size() {
        return migrations.size();
    }
}
