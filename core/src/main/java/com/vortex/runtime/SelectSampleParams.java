package com.vortex.runtime;

import com.vortex.logql.Expr;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Parameters of a metric query.
 *
 * @param expr the sample expression
 * @param start inclusive lower bound
 * @param end inclusive upper bound
 * @param step evaluation step
 */
public record SelectSampleParams(Expr expr, Instant start, Instant end, Duration step) {

    public SelectSampleParams {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(step, "step must not be null");
    }
}
