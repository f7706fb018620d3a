package com.vortex.runtime;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions from the objects JDBC drivers return for the log table columns.
 *
 * <p>Timestamps without a zone are read as UTC. Map columns arrive as
 * {@link java.util.Map} from both the ClickHouse and DuckDB drivers.
 */
final class JdbcValues {

    private JdbcValues() {} // Utility class

    /**
     * Converts a timestamp column value.
     *
     * @param value the value from {@code ResultSet.getObject}
     * @return the instant
     * @throws SQLException if the value is null or not a timestamp
     */
    static Instant toInstant(Object value) throws SQLException {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value == null) {
            throw new SQLException("timestamp column is null");
        }
        throw new SQLException("timestamp column has unsupported type " + value.getClass().getName());
    }

    /**
     * Converts a map column value. Null values become empty strings; null
     * keys are dropped.
     *
     * @param value the value from {@code ResultSet.getObject}
     * @return the map with string keys and values
     * @throws SQLException if the value is not a map
     */
    static Map<String, String> toStringMap(Object value) throws SQLException {
        if (!(value instanceof Map<?, ?> raw)) {
            throw new SQLException("label column is not a map: " +
                (value == null ? "null" : value.getClass().getName()));
        }
        Map<String, String> result = new LinkedHashMap<>(raw.size() * 2);
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            if (e.getKey() == null) {
                continue;
            }
            result.put(e.getKey().toString(), e.getValue() == null ? "" : e.getValue().toString());
        }
        return result;
    }
}
