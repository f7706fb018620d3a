package com.vortex.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("tier1")
@DisplayName("JDBC value conversion")
public class JdbcValuesTest {

    private static final Instant T = Instant.parse("2024-05-01T10:00:00.123456Z");

    @Test
    @DisplayName("Timestamps of every driver flavor become the same instant")
    void testToInstant() throws SQLException {
        LocalDateTime local = LocalDateTime.ofInstant(T, ZoneOffset.UTC);

        assertThat(JdbcValues.toInstant(T)).isEqualTo(T);
        assertThat(JdbcValues.toInstant(local)).isEqualTo(T);
        assertThat(JdbcValues.toInstant(OffsetDateTime.of(local, ZoneOffset.UTC).withOffsetSameInstant(ZoneOffset.ofHours(2))))
            .isEqualTo(T);
        assertThat(JdbcValues.toInstant(Timestamp.valueOf(local))).isEqualTo(T);
    }

    @Test
    @DisplayName("Null or foreign timestamp values fail")
    void testBadTimestamp() {
        assertThatThrownBy(() -> JdbcValues.toInstant(null)).isInstanceOf(SQLException.class);
        assertThatThrownBy(() -> JdbcValues.toInstant("2024-05-01")).isInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("Map values become strings, nulls become empty")
    void testToStringMap() throws SQLException {
        Map<Object, Object> raw = new HashMap<>();
        raw.put("a", "1");
        raw.put("b", null);
        raw.put("c", 3);
        raw.put(null, "dropped");

        assertThat(JdbcValues.toStringMap(raw)).containsOnly(entry("a", "1"), entry("b", ""), entry("c", "3"));
    }

    @Test
    @DisplayName("Non-map label column fails")
    void testNotAMap() {
        assertThatThrownBy(() -> JdbcValues.toStringMap("service.name=api"))
            .isInstanceOf(SQLException.class)
            .hasMessageContaining("not a map");
    }
}
