package com.vortex.generator;

import com.vortex.logql.MatchType;

import java.time.Instant;
import java.util.Set;

/**
 * The engine-specific parts of a log query.
 *
 * <p>The generator composes statements from these building blocks and never
 * refers to an engine directly, so the same LogQL expression can be
 * translated for ClickHouse, for DuckDB, or for a test double.
 *
 * @see ClickHouseDialect
 * @see DuckDBDialect
 */
public interface SQLDialect {

    /**
     * Returns the dialect name used in configuration and log messages.
     *
     * @return the dialect name
     */
    String name();

    /**
     * Quotes a database, table or column name.
     *
     * @param identifier the identifier
     * @return the quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quotes a database-qualified table reference.
     *
     * @param database the database or schema name
     * @param table the table name
     * @return the quoted reference, e.g. {@code `otel`.`logs`}
     * @throws IllegalArgumentException if a name contains statement separators or comments
     */
    String qualifiedTable(String database, String table);

    /**
     * Converts an instant to the engine's native timestamp value.
     *
     * @param instant the point in time
     * @return a fragment binding the instant as an argument
     * @throws IllegalArgumentException if the engine cannot represent the instant
     */
    SQLFragment timestamp(Instant instant);

    /**
     * Reads one key out of a map column.
     *
     * @param mapColumn the quoted map column
     * @param key the storage key, bound as an argument
     * @return a fragment evaluating to the value, or an empty string when the key is absent
     */
    SQLFragment mapElement(String mapColumn, String key);

    /**
     * Expands a map column into one row per key.
     *
     * @param mapColumn the quoted map column
     * @return the SQL expression
     */
    String mapKeys(String mapColumn);

    /**
     * Tests a string expression against a regular expression.
     *
     * @param subject the string expression
     * @param pattern the regular expression, bound as an argument
     * @return a boolean fragment
     */
    SQLFragment regexMatch(SQLFragment subject, String pattern);

    /**
     * Tests whether a string expression contains a substring.
     *
     * @param subject the string expression
     * @param substring the text to look for, matched literally
     * @param negated true for "does not contain"
     * @return a boolean fragment
     */
    SQLFragment contains(SQLFragment subject, String substring, boolean negated);

    /**
     * Returns the comparisons this dialect can express.
     *
     * @return the supported match types
     */
    Set<MatchType> supportedMatchTypes();

    default boolean supports(MatchType type) {
        return supportedMatchTypes().contains(type);
    }
}
