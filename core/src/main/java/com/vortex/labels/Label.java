package com.vortex.labels;

import java.util.Objects;

/**
 * A single label name/value pair.
 */
public record Label(String name, String value) implements Comparable<Label> {

    public Label {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public int compareTo(Label other) {
        int cmp = name.compareTo(other.name);
        return cmp != 0 ? cmp : value.compareTo(other.value);
    }
}
