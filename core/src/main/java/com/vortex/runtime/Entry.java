package com.vortex.runtime;

import java.time.Instant;
import java.util.Objects;

/**
 * One log line and its timestamp.
 */
public record Entry(Instant timestamp, String line) {

    private static final Entry EMPTY = new Entry(Instant.EPOCH, "");

    public Entry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(line, "line must not be null");
    }

    /**
     * Returns the entry reported for a row that could not be decoded.
     *
     * @return the entry at the epoch with an empty line
     */
    public static Entry empty() {
        return EMPTY;
    }
}
