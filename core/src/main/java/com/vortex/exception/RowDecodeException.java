package com.vortex.exception;

/**
 * Exception raised when a result row cannot be decoded into a log entry:
 * the columns cannot be read, or the label column is not a map.
 *
 * <p>The failure belongs to a single row. It is cached by the reader and
 * reported through {@link com.vortex.runtime.EntryIterator#error()}.
 */
public class RowDecodeException extends RuntimeException {

    /**
     * Creates a row decode exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public RowDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
