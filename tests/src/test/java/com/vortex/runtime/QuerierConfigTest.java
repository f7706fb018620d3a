package com.vortex.runtime;

import com.vortex.generator.ClickHouseDialect;
import com.vortex.generator.DuckDBDialect;
import com.vortex.generator.OtelQueryEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("tier1")
@DisplayName("QuerierConfig")
public class QuerierConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(QuerierConfig.PROP_DATABASE);
        System.clearProperty(QuerierConfig.PROP_TABLE);
        System.clearProperty(QuerierConfig.PROP_DIALECT);
    }

    @Test
    @DisplayName("Defaults to otel.logs in ClickHouse")
    void testDefaults() {
        QuerierConfig config = QuerierConfig.from(new Properties());

        assertThat(config.database()).isEqualTo("otel");
        assertThat(config.table()).isEqualTo("logs");
        assertThat(config.dialect()).isInstanceOf(ClickHouseDialect.class);
    }

    @Test
    @DisplayName("Reads system properties")
    void testSystemProperties() {
        System.setProperty(QuerierConfig.PROP_DATABASE, "observability");
        System.setProperty(QuerierConfig.PROP_TABLE, "app_logs");
        System.setProperty(QuerierConfig.PROP_DIALECT, "duckdb");

        QuerierConfig config = QuerierConfig.fromSystemProperties();

        assertThat(config.database()).isEqualTo("observability");
        assertThat(config.table()).isEqualTo("app_logs");
        assertThat(config.dialect()).isInstanceOf(DuckDBDialect.class);
    }

    @Test
    @DisplayName("Blank values fall back to defaults")
    void testBlankValues() {
        Properties props = new Properties();
        props.setProperty(QuerierConfig.PROP_TABLE, "  ");

        assertThat(QuerierConfig.from(props).table()).isEqualTo("logs");
    }

    @Test
    @DisplayName("Dialect names are case-insensitive")
    void testDialectCase() {
        assertThat(QuerierConfig.parseDialect(" DuckDB ")).isInstanceOf(DuckDBDialect.class);
        assertThat(QuerierConfig.parseDialect("CLICKHOUSE")).isInstanceOf(ClickHouseDialect.class);
        assertThat(QuerierConfig.parseDialect(null)).isInstanceOf(ClickHouseDialect.class);
    }

    @Test
    @DisplayName("Unknown dialect is rejected")
    void testUnknownDialect() {
        assertThatThrownBy(() -> QuerierConfig.parseDialect("postgres"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("postgres")
            .hasMessageContaining("clickhouse, duckdb");
    }

    @Test
    @DisplayName("Creates an environment for the configured table")
    void testCreateEnvironment() {
        Properties props = new Properties();
        props.setProperty(QuerierConfig.PROP_DIALECT, "duckdb");
        props.setProperty(QuerierConfig.PROP_DATABASE, "main");

        OtelQueryEnvironment env = (OtelQueryEnvironment) QuerierConfig.from(props).createEnvironment();

        assertThat(env.tableName()).isEqualTo("\"main\".\"logs\"");
        assertThat(env.dialect().name()).isEqualTo("duckdb");
    }
}
