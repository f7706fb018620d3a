package com.vortex.runtime;

import com.vortex.logql.Matcher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Request for the label sets matching groups of matchers.
 *
 * <p>Every matcher of every group must hold.
 *
 * @param groups matcher groups
 * @param start inclusive lower bound
 * @param end inclusive upper bound
 */
public record SeriesRequest(List<List<Matcher>> groups, Instant start, Instant end) {

    public SeriesRequest {
        Objects.requireNonNull(groups, "groups must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        List<List<Matcher>> copy = new ArrayList<>(groups.size());
        for (List<Matcher> group : groups) {
            copy.add(List.copyOf(group));
        }
        groups = List.copyOf(copy);
    }
}
