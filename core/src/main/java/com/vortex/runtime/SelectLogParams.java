package com.vortex.runtime;

import com.vortex.logql.Direction;
import com.vortex.logql.LogSelectorExpr;

import java.time.Instant;
import java.util.Objects;

/**
 * Parameters of a log line query.
 *
 * @param selector the stream selector and its line filters
 * @param start inclusive lower bound
 * @param end inclusive upper bound
 * @param limit maximum number of lines, not negative
 * @param direction line order, may be null
 */
public record SelectLogParams(LogSelectorExpr selector, Instant start, Instant end,
                              int limit, Direction direction) {

    public SelectLogParams {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }
}
