package com.vortex.exception;

/**
 * Exception thrown when a translated statement fails to execute.
 *
 * <p>Wraps the driver's SQLException together with the statement text so the
 * failure can be reported without re-running the translation.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       List&lt;String&gt; names = querier.label(LabelRequest.names(start, end));
 *   } catch (QueryExecutionException e) {
 *       logger.error(e.getUserMessage());
 *       logger.debug("Failed SQL: {}", e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.vortex.runtime.JdbcLogQuerier
 */
public class QueryExecutionException extends RuntimeException {

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Recognizes the common ClickHouse and DuckDB failures of a log
     * query: missing table, missing column, bad regular expression, timeout.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Log query execution failed.";
        }

        if (message.contains("UNKNOWN_TABLE") || message.contains("UNKNOWN_DATABASE") ||
            (message.contains("Catalog Error") && message.contains("does not exist"))) {
            return "Log table not found. Check the configured database and table names.";
        }

        if (message.contains("UNKNOWN_IDENTIFIER") ||
            (message.contains("Binder Error") && message.contains("not found"))) {
            return "Log table is missing an expected column (Timestamp, Body, ResourceAttributes). " +
                   "Check that the table uses the OpenTelemetry logs schema.";
        }

        if (message.contains("CANNOT_COMPILE_REGEXP") || message.contains("Invalid Input Error")) {
            return "Invalid regular expression in query: " + message;
        }

        if (message.contains("TIMEOUT_EXCEEDED") || message.contains("INTERRUPTED")) {
            return "Log query timed out. Narrow the time range or add label matchers.";
        }

        return "Log query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
