package com.vortex.runtime;

import com.vortex.generator.ClickHouseDialect;
import com.vortex.generator.DuckDBDialect;
import com.vortex.generator.OtelQueryEnvironment;
import com.vortex.generator.QueryEnvironment;
import com.vortex.generator.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Properties;

/**
 * Querier configuration: which table to read and which SQL dialect to emit.
 *
 * <p>Read from system properties:
 * <ul>
 *   <li>{@code vortex.database}: database holding the logs table (default {@code otel})</li>
 *   <li>{@code vortex.table}: logs table (default {@code logs})</li>
 *   <li>{@code vortex.dialect}: {@code clickhouse} or {@code duckdb} (default {@code clickhouse})</li>
 * </ul>
 */
public final class QuerierConfig {

    private static final Logger logger = LoggerFactory.getLogger(QuerierConfig.class);

    /** System property for the database name */
    public static final String PROP_DATABASE = "vortex.database";

    /** System property for the table name */
    public static final String PROP_TABLE = "vortex.table";

    /** System property for the SQL dialect */
    public static final String PROP_DIALECT = "vortex.dialect";

    public static final String DEFAULT_DATABASE = "otel";
    public static final String DEFAULT_TABLE = "logs";
    public static final String DEFAULT_DIALECT = ClickHouseDialect.NAME;

    private final String database;
    private final String table;
    private final SQLDialect dialect;

    public QuerierConfig(String database, String table, SQLDialect dialect) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * Reads the configuration from system properties.
     *
     * @return the configuration
     * @throws IllegalArgumentException if the dialect is unknown
     */
    public static QuerierConfig fromSystemProperties() {
        return from(System.getProperties());
    }

    /**
     * Reads the configuration from properties; missing or blank entries take
     * their defaults.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if the dialect is unknown
     */
    public static QuerierConfig from(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        QuerierConfig config = new QuerierConfig(
            valueOrDefault(properties, PROP_DATABASE, DEFAULT_DATABASE),
            valueOrDefault(properties, PROP_TABLE, DEFAULT_TABLE),
            parseDialect(valueOrDefault(properties, PROP_DIALECT, DEFAULT_DIALECT)));
        logger.info("Querier configured: table={}.{}, dialect={}",
            config.database, config.table, config.dialect.name());
        return config;
    }

    /**
     * Parse a dialect name (case-insensitive).
     *
     * @param value "clickhouse" or "duckdb"
     * @return the dialect
     * @throws IllegalArgumentException if value is not recognized
     */
    public static SQLDialect parseDialect(String value) {
        if (value == null) {
            return new ClickHouseDialect();
        }
        return switch (value.trim().toLowerCase()) {
            case ClickHouseDialect.NAME -> new ClickHouseDialect();
            case DuckDBDialect.NAME -> new DuckDBDialect();
            default -> throw new IllegalArgumentException(
                "Unknown SQL dialect: '%s'. Valid values: clickhouse, duckdb".formatted(value));
        };
    }

    /**
     * Creates the query environment for the configured table.
     *
     * @return the environment
     */
    public QueryEnvironment createEnvironment() {
        return new OtelQueryEnvironment(dialect, database, table);
    }

    public String database() {
        return database;
    }

    public String table() {
        return table;
    }

    public SQLDialect dialect() {
        return dialect;
    }

    private static String valueOrDefault(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }
}
