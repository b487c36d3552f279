package io.relaydb.migration;

import java.sql.SQLException;

/**
 * One-time bulk rewrite of existing rows into a new representation, run after the
 * migration that introduced the representation has been committed.
 *
 * <p>A backfill manages its own transactions. It either commits all of its writes
 * or none of them.
 */
public interface Backfill {

    /**
     * Task name shown in progress output, e.g. {@code "rebuilding tags table"}.
     */
    String name();

    /**
     * Runs the rewrite to completion.
     *
     * @throws SQLException if the database fails; nothing has been committed in that case
     */
    void run(BackfillContext context) throws SQLException;
}
