package com.vortex.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Row cursor over a JDBC result set with the columns
 * {@code (timestamp, body, attribute map)}.
 *
 * <p>Owns the result set, the statement that produced it and the connection
 * the statement ran on; all three are closed with the cursor, in reverse
 * order of acquisition.
 */
public class JdbcRowCursor implements RowCursor {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRowCursor.class);

    private final ResultSet resultSet;
    private final Statement statement;
    private final Connection connection;

    private SQLException error = null;
    private boolean closed = false;
    private long rowCount = 0;

    /**
     * Creates a cursor.
     *
     * @param resultSet the result set to read
     * @param statement the statement that created it, may be null
     * @param connection the connection to release on close, may be null
     */
    public JdbcRowCursor(ResultSet resultSet, Statement statement, Connection connection) {
        this.resultSet = resultSet;
        this.statement = statement;
        this.connection = connection;
    }

    @Override
    public boolean next() {
        if (closed || error != null) {
            return false;
        }
        try {
            boolean hasRow = resultSet.next();
            if (hasRow) {
                rowCount++;
            }
            return hasRow;
        } catch (SQLException e) {
            error = e;
            logger.error("Error advancing result set after {} rows", rowCount, e);
            return false;
        }
    }

    @Override
    public RawLogRow scan() throws SQLException {
        if (closed) {
            throw new SQLException("Cursor is closed");
        }
        return new RawLogRow(
            JdbcValues.toInstant(resultSet.getObject(1)),
            nullToEmpty(resultSet.getString(2)),
            JdbcValues.toStringMap(resultSet.getObject(3)));
    }

    @Override
    public Exception error() {
        return error;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.debug("Closing JdbcRowCursor after {} rows", rowCount);

        closeQuietly(resultSet, "ResultSet");
        closeQuietly(statement, "Statement");
        closeQuietly(connection, "Connection");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static void closeQuietly(AutoCloseable resource, String name) {
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
