package com.vortex.generator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * DuckDB rendering, for a logs table with a {@code MAP(VARCHAR, VARCHAR)}
 * attribute column.
 *
 * <pre>
 *   "otel"."logs"
 *   make_timestamp(CAST(? AS BIGINT))          -- epoch microseconds
 *   coalesce(map_extract("ResourceAttributes", CAST(? AS VARCHAR))[1], '')
 *   unnest(map_keys("ResourceAttributes"))
 *   regexp_matches("Body", ?)                  -- RE2, unanchored
 *   "Body" LIKE ? ESCAPE '\'
 * </pre>
 *
 * <p>Parameters of polymorphic functions carry an explicit cast; DuckDB cannot
 * type them when the statement is prepared.
 *
 * <p>Absent keys read as an empty string, as they do in ClickHouse, so that
 * {@code {env!="prod"}} also selects rows without an {@code env} attribute.
 */
public final class DuckDBDialect extends AbstractSQLDialect {

    public static final String NAME = "duckdb";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected char identifierQuote() {
        return '"';
    }

    @Override
    protected char likeEscape() {
        return '\\';
    }

    @Override
    protected String likeEscapeClause() {
        return " ESCAPE '\\'";
    }

    @Override
    public SQLFragment timestamp(Instant instant) {
        return SQLFragment.of("make_timestamp(CAST(? AS BIGINT))", epochMicros(instant));
    }

    static long epochMicros(Instant instant) {
        try {
            return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Timestamp out of range for " + NAME + ": " + instant, e);
        }
    }

    @Override
    public SQLFragment mapElement(String mapColumn, String key) {
        return SQLFragment.of("coalesce(map_extract(" + mapColumn + ", CAST(? AS VARCHAR))[1], '')", key);
    }

    @Override
    public String mapKeys(String mapColumn) {
        return "unnest(map_keys(" + mapColumn + "))";
    }

    @Override
    public SQLFragment regexMatch(SQLFragment subject, String pattern) {
        return subject.wrap("regexp_matches(", ", ?)", pattern);
    }
}
