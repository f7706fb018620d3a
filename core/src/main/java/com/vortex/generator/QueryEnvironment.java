package com.vortex.generator;

import com.vortex.logql.Direction;
import com.vortex.logql.LogSelectorExpr;
import com.vortex.logql.Matcher;

import java.time.Instant;
import java.util.List;

/**
 * Translates the three query shapes served by the querier into
 * parameterized SQL. Implementations are stateless and thread-safe.
 */
public interface QueryEnvironment {

    /**
     * Builds the statement selecting log lines.
     *
     * <p>Result columns: timestamp, body, attribute map.
     *
     * @param selector the stream selector and its line filters
     * @param start inclusive lower bound
     * @param end inclusive upper bound
     * @param limit maximum number of lines
     * @param direction line order, or null for no direction
     * @return the statement
     */
    SQLStatement selectLogsQuery(LogSelectorExpr selector, Instant start, Instant end,
                                 int limit, Direction direction);

    /**
     * Builds the statement listing label names, or the values of one label.
     *
     * <p>Result column: a single string.
     *
     * @param name the label whose values are listed; ignored when {@code values} is false
     * @param values true for the distinct values of {@code name}, false for all label names
     * @param start optional lower bound, null for none
     * @param end optional upper bound, null for none
     * @return the statement
     */
    SQLStatement labelQuery(String name, boolean values, Instant start, Instant end);

    /**
     * Builds the statement listing the distinct label sets matching the groups.
     *
     * <p>Result column: the attribute map.
     *
     * @param groups matcher groups
     * @param start inclusive lower bound
     * @param end inclusive upper bound
     * @return the statement
     */
    SQLStatement seriesQuery(List<List<Matcher>> groups, Instant start, Instant end);
}
