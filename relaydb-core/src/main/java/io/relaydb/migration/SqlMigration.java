package io.relaydb.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Migration made of fixed SQL statements, executed in order.
 *
 * @param serialNumber positive serial number
 * @param description  short summary
 * @param statements   statements to execute, at least one
 * @param backfillStep backfill to run after commit, or {@code null}
 */
public record SqlMigration(
        long serialNumber,
        String description,
        List<String> statements,
        Backfill backfillStep
) implements Migration {

    public SqlMigration {
        if (serialNumber <= 0) {
            throw new IllegalArgumentException("serialNumber must be > 0");
        }
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(statements, "statements");
        if (statements.isEmpty()) {
            throw new IllegalArgumentException("statements must not be empty");
        }
        for (String sql : statements) {
            if (sql == null || sql.isBlank()) {
                throw new IllegalArgumentException("statements must not contain blank SQL");
            }
        }
        statements = List.copyOf(statements);
    }

    public static SqlMigration of(long serialNumber, String description, String... statements) {
        return new SqlMigration(serialNumber, description, List.of(statements), null);
    }

    /**
     * Returns a copy of this migration that runs {@code backfill} after it is applied.
     */
    public SqlMigration withBackfill(Backfill backfill) {
        return new SqlMigration(serialNumber, description, statements,
                Objects.requireNonNull(backfill, "backfill"));
    }

    @Override
    public Optional<Backfill> backfill() {
        return Optional.ofNullable(backfillStep);
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        for (String sql : statements) {
            try (Statement statement = conn.createStatement()) {
                statement.execute(sql);
            }
        }
    }
}
