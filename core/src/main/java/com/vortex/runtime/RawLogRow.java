package com.vortex.runtime;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A log row as read from the cursor, before label normalization.
 *
 * @param timestamp the row timestamp
 * @param body the log line
 * @param attributes storage-side attribute keys to values
 */
public record RawLogRow(Instant timestamp, String body, Map<String, String> attributes) {

    public RawLogRow {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(body, "body must not be null");
        attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes must not be null"));
    }
}
