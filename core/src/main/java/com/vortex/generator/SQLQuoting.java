package com.vortex.generator;

/**
 * Utilities for safely quoting SQL identifiers and LIKE patterns.
 *
 * <p>Values never go through this class: they are bound as statement
 * arguments. Quoting is only needed for the parts of a statement that cannot
 * be bound, namely database, table and column names, and for the wildcard
 * characters of a LIKE pattern.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("logs", '`');        // `logs`
 *   SQLQuoting.quoteIdentifier("my\"table", '"');   // "my""table"
 *   SQLQuoting.escapeLikePattern("50%_off", '\\');  // 50\%\_off
 * </pre>
 *
 * @see SQLDialect#quoteIdentifier(String)
 */
public final class SQLQuoting {

    private SQLQuoting() {} // Utility class

    /**
     * Quotes an identifier (database, table or column name).
     *
     * <p>Wraps the identifier in the quote character and escapes embedded
     * quote characters by doubling them.
     *
     * @param identifier the identifier to quote
     * @param quote the dialect's identifier quote character
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier, char quote) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }

    /**
     * Quotes a table name for use in SQL.
     *
     * <p>Rejects names containing statement separators or comment markers,
     * which have no business in a configured table name.
     *
     * @param tableName the table name to quote
     * @param quote the dialect's identifier quote character
     * @return quoted table name safe for SQL
     * @throws IllegalArgumentException if table name is null or contains invalid characters
     */
    public static String quoteTableName(String tableName, char quote) {
        if (tableName == null) {
            throw new IllegalArgumentException("Table name cannot be null");
        }

        if (tableName.contains(";") || tableName.contains("--") ||
            tableName.contains("/*") || tableName.contains("*/")) {
            throw new IllegalArgumentException(
                "Table name contains invalid characters: " + tableName);
        }

        return quoteIdentifier(tableName, quote);
    }

    /**
     * Escapes the LIKE wildcards {@code %} and {@code _}, and the escape
     * character itself, so the pattern matches literally.
     *
     * @param literal the text to match literally
     * @param escape the escape character declared for the LIKE predicate
     * @return the escaped pattern
     */
    public static String escapeLikePattern(String literal, char escape) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '%' || c == '_' || c == escape) {
                sb.append(escape);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
