package io.relaydb.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Migration whose change is performed by code rather than fixed statements.
 *
 * @param serialNumber positive serial number
 * @param description  short summary
 * @param transform    the change, run inside the migration transaction
 * @param backfillStep backfill to run after commit, or {@code null}
 */
public record ProceduralMigration(
        long serialNumber,
        String description,
        SchemaTransform transform,
        Backfill backfillStep
) implements Migration {

    public ProceduralMigration {
        if (serialNumber <= 0) {
            throw new IllegalArgumentException("serialNumber must be > 0");
        }
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(transform, "transform");
    }

    public static ProceduralMigration of(long serialNumber, String description, SchemaTransform transform) {
        return new ProceduralMigration(serialNumber, description, transform, null);
    }

    public ProceduralMigration withBackfill(Backfill backfill) {
        return new ProceduralMigration(serialNumber, description, transform,
                Objects.requireNonNull(backfill, "backfill"));
    }

    @Override
    public Optional<Backfill> backfill() {
        return Optional.ofNullable(backfillStep);
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        transform.apply(conn);
    }
}
