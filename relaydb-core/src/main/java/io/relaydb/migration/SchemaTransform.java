package io.relaydb.migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Custom schema or data change run inside a migration transaction.
 *
 * @see ProceduralMigration
 */
@FunctionalInterface
public interface SchemaTransform {

    /**
     * @param conn the migration's transactional connection; do not commit, roll back or close it
     */
    void apply(Connection conn) throws SQLException;
}
