package com.vortex.generator;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * A complete parameterized statement: SQL text plus positional arguments.
 *
 * <p>Example usage:
 * <pre>
 *   SQLStatement stmt = environment.labelQuery("env", true, null, null);
 *   try (PreparedStatement ps = connection.prepareStatement(stmt.sql())) {
 *       stmt.bind(ps);
 *       ResultSet rs = ps.executeQuery();
 *   }
 * </pre>
 */
public final class SQLStatement {

    private final String sql;
    private final List<Object> args;

    /**
     * Creates a statement from an assembled fragment.
     *
     * @param fragment the full statement
     */
    public SQLStatement(SQLFragment fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        this.sql = fragment.text();
        this.args = fragment.args();
    }

    public String sql() {
        return sql;
    }

    /**
     * Returns the positional arguments, in placeholder order.
     *
     * @return an unmodifiable list
     */
    public List<Object> args() {
        return args;
    }

    /**
     * Binds every argument to the prepared statement, first argument to
     * parameter index 1.
     *
     * @param statement a statement prepared from {@link #sql()}
     * @throws SQLException if the driver rejects a value
     */
    public void bind(PreparedStatement statement) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            statement.setObject(i + 1, args.get(i));
        }
    }

    @Override
    public String toString() {
        return sql + " " + args;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SQLStatement)) return false;
        SQLStatement that = (SQLStatement) obj;
        return sql.equals(that.sql) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, args);
    }
}
