package com.vortex.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builder for a single-table SELECT statement.
 *
 * <p>Clauses may be added in any order; {@link #build()} assembles them in
 * SQL order and collects the arguments of every fragment in placeholder
 * order:
 * <pre>
 *   SELECT [DISTINCT] col, ... FROM table
 *   [WHERE cond AND cond ...] [ORDER BY ...] [LIMIT n]
 * </pre>
 *
 * <p>Not thread-safe; create one builder per statement.
 */
public final class SelectBuilder {

    private final List<SQLFragment> columns = new ArrayList<>();
    private final List<SQLFragment> conditions = new ArrayList<>();
    private boolean distinct;
    private String table;
    private String orderBy;
    private int limit = -1;

    public SelectBuilder select(String... columnSql) {
        for (String column : columnSql) {
            columns.add(SQLFragment.of(column));
        }
        return this;
    }

    public SelectBuilder select(SQLFragment column) {
        columns.add(Objects.requireNonNull(column, "column must not be null"));
        return this;
    }

    public SelectBuilder distinct() {
        this.distinct = true;
        return this;
    }

    /**
     * Sets the FROM clause.
     *
     * @param tableSql the quoted table reference
     * @return this builder
     */
    public SelectBuilder from(String tableSql) {
        this.table = Objects.requireNonNull(tableSql, "table must not be null");
        return this;
    }

    /**
     * Adds a condition; all conditions are AND-ed.
     *
     * @param condition a boolean fragment
     * @return this builder
     */
    public SelectBuilder where(SQLFragment condition) {
        conditions.add(Objects.requireNonNull(condition, "condition must not be null"));
        return this;
    }

    public SelectBuilder orderBy(String orderBySql) {
        this.orderBy = Objects.requireNonNull(orderBySql, "orderBy must not be null");
        return this;
    }

    /**
     * Sets the row limit.
     *
     * @param limit maximum number of rows
     * @return this builder
     * @throws IllegalArgumentException if limit is negative
     */
    public SelectBuilder limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        this.limit = limit;
        return this;
    }

    /**
     * Assembles the statement.
     *
     * @return the statement text and arguments
     * @throws IllegalStateException if no column or no table was set
     */
    public SQLStatement build() {
        if (columns.isEmpty()) {
            throw new IllegalStateException("SELECT requires at least one column");
        }
        if (table == null) {
            throw new IllegalStateException("SELECT requires a FROM table");
        }

        SQLFragment sql = SQLFragment.of(distinct ? "SELECT DISTINCT " : "SELECT ")
            .append(SQLFragment.join(", ", columns))
            .append(" FROM " + table);

        if (!conditions.isEmpty()) {
            sql = sql.append(" WHERE ").append(SQLFragment.join(" AND ", conditions));
        }
        if (orderBy != null) {
            sql = sql.append(" ORDER BY " + orderBy);
        }
        if (limit >= 0) {
            sql = sql.append(" LIMIT " + limit);
        }
        return new SQLStatement(sql);
    }
}
