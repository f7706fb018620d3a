package com.vortex.generator;

import java.time.Instant;

/**
 * ClickHouse rendering, for the OpenTelemetry exporter's logs table.
 *
 * <pre>
 *   `otel`.`logs`
 *   fromUnixTimestamp64Nano(?)              -- epoch nanoseconds
 *   arrayElement(`ResourceAttributes`, ?)   -- '' when the key is absent
 *   arrayJoin(mapKeys(`ResourceAttributes`))
 *   match(`Body`, ?)                        -- RE2, unanchored
 * </pre>
 */
public final class ClickHouseDialect extends AbstractSQLDialect {

    public static final String NAME = "clickhouse";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected char identifierQuote() {
        return '`';
    }

    @Override
    protected char likeEscape() {
        return '\\';
    }

    @Override
    public SQLFragment timestamp(Instant instant) {
        return SQLFragment.of("fromUnixTimestamp64Nano(?)", epochNanos(instant));
    }

    @Override
    public SQLFragment mapElement(String mapColumn, String key) {
        return SQLFragment.of("arrayElement(" + mapColumn + ", ?)", key);
    }

    @Override
    public String mapKeys(String mapColumn) {
        return "arrayJoin(mapKeys(" + mapColumn + "))";
    }

    @Override
    public SQLFragment regexMatch(SQLFragment subject, String pattern) {
        return subject.wrap("match(", ", ?)", pattern);
    }

    /**
     * Converts an instant to epoch nanoseconds, the range of {@code DateTime64(9)}.
     *
     * @throws IllegalArgumentException if the instant is outside 1677-09-21 .. 2262-04-11
     */
    static long epochNanos(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Timestamp out of range for " + NAME + ": " + instant, e);
        }
    }
}
