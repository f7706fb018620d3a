package com.vortex.runtime;

import java.time.Instant;
import java.util.Objects;

/**
 * Request for label names, or for the values of one label.
 *
 * @param name the label whose values are listed, null when listing names
 * @param values true to list values of {@code name}
 * @param start optional lower bound
 * @param end optional upper bound
 */
public record LabelRequest(String name, boolean values, Instant start, Instant end) {

    public LabelRequest {
        if (values) {
            Objects.requireNonNull(name, "name must not be null when listing values");
        }
    }

    /**
     * Lists every label name.
     */
    public static LabelRequest names(Instant start, Instant end) {
        return new LabelRequest(null, false, start, end);
    }

    /**
     * Lists the distinct values of one label.
     */
    public static LabelRequest values(String name, Instant start, Instant end) {
        return new LabelRequest(name, true, start, end);
    }
}
