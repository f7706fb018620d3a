package com.vortex.runtime;

import java.sql.SQLException;

/**
 * Forward-only, single-pass cursor over log rows.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RowCursor cursor = ...) {
 *     while (cursor.next()) {
 *         RawLogRow row = cursor.scan();
 *     }
 *     if (cursor.error() != null) {
 *         // iteration stopped on a failure, not at the end of the rows
 *     }
 * }
 * }</pre>
 */
public interface RowCursor extends AutoCloseable {

    /**
     * Moves to the next row.
     *
     * <p>A failure while advancing is recorded in {@link #error()} and ends
     * the iteration.
     *
     * @return true if a row is available, false at the end or on failure
     */
    boolean next();

    /**
     * Reads the current row.
     *
     * @return the row
     * @throws SQLException if the row cannot be read or has the wrong shape
     */
    RawLogRow scan() throws SQLException;

    /**
     * Returns the failure that ended the iteration.
     *
     * @return the exception, or null if the cursor is healthy
     */
    Exception error();

    /**
     * Releases the cursor and everything it owns.
     */
    @Override
    void close();
}
