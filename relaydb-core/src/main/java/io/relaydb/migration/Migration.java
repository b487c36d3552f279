package io.relaydb.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * One versioned, ordered unit of schema change.
 *
 * <p>The serial number is both the identity of a migration and its position in the
 * upgrade sequence. Once a migration has shipped, neither its serial number nor
 * what it does may change: every deployment must replay exactly the same history.
 *
 * <p>Two kinds exist:
 * <ul>
 *   <li>{@link SqlMigration}: an ordered list of statements run in one transaction.</li>
 *   <li>{@link ProceduralMigration}: a {@link SchemaTransform} callback for changes that
 *       cannot be expressed as fixed statements.</li>
 * </ul>
 *
 * <p>Either kind may carry a {@link Backfill}, run once after the schema change has
 * been committed.
 *
 * @see MigrationRegistry
 */
public sealed interface Migration permits SqlMigration, ProceduralMigration {

    /**
     * Positive serial number, unique within a {@link MigrationRegistry}.
     */
    long serialNumber();

    /**
     * Short human readable summary, used in log output.
     */
    String description();

    /**
     * Data rewrite to run after this migration has been applied, if any.
     */
    Optional<Backfill> backfill();

    /**
     * Applies the schema change on the given connection. The caller owns the
     * transaction; implementations must not commit or roll back.
     *
     * @param conn connection with auto-commit disabled
     * @throws SQLException if any part of the change fails
     */
    void apply(Connection conn) throws SQLException;
}
