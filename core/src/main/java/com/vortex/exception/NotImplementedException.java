package com.vortex.exception;

/**
 * Thrown for query shapes this querier does not serve (metric queries, live
 * tailing, index statistics, volume). Never replaced by an empty result.
 */
public class NotImplementedException extends UnsupportedOperationException {

    private final String operation;

    /**
     * Creates the exception for a named operation.
     *
     * @param operation the operation name, e.g. {@code SelectSamples}
     */
    public NotImplementedException(String operation) {
        super(operation + ": not implemented");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
