package com.vortex.exception;

import com.vortex.logql.Expr;

/**
 * Exception thrown when a LogQL expression cannot be translated to SQL.
 *
 * <p>Raised before any statement reaches the database. The translation never
 * returns a statement that silently ignores a label matcher: a matcher that the
 * target dialect cannot express fails the whole query.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       SQLStatement stmt = environment.selectLogsQuery(selector, start, end, 100, Direction.BACKWARD);
 *   } catch (SQLGenerationException e) {
 *       logger.error(e.getTechnicalMessage());
 *   }
 * </pre>
 *
 * @see com.vortex.generator.LogQLTransformer
 */
public class SQLGenerationException extends RuntimeException {

    private final Expr failedExpr;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param expr the expression being translated, may be null
     */
    public SQLGenerationException(String message, Expr expr) {
        super(message);
        this.failedExpr = expr;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param expr the expression being translated, may be null
     */
    public SQLGenerationException(String message, Throwable cause, Expr expr) {
        super(message, cause);
        this.failedExpr = expr;
    }

    /**
     * Returns the expression that failed to translate.
     *
     * @return the expression, or null if not available
     */
    public Expr getFailedExpr() {
        return failedExpr;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedExpr != null) {
            sb.append("Expression Type: ").append(failedExpr.getClass().getSimpleName()).append("\n");
            sb.append("Expression: ").append(failedExpr).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
