package com.vortex.runtime;

import com.vortex.labels.LabelNames;
import com.vortex.labels.Labels;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * A row with its labels normalized and its stream string rendered.
 */
final class DecodedRow {

    private final Instant timestamp;
    private final String body;
    private final Map<String, String> rawLabels;
    private final Labels labels;
    private final String labelString;

    private DecodedRow(Instant timestamp, String body, Map<String, String> rawLabels, Labels labels) {
        this.timestamp = timestamp;
        this.body = body;
        this.rawLabels = rawLabels;
        this.labels = labels;
        this.labelString = labels.toString();
    }

    /**
     * Normalizes every raw key. Raw keys are processed in sorted order, so when
     * two keys normalize to the same name the last one in that order wins.
     */
    static DecodedRow decode(RawLogRow raw) {
        Map<String, String> normalized = new TreeMap<>();
        new TreeMap<>(raw.attributes()).forEach((key, value) ->
            normalized.put(LabelNames.normalize(key), value));
        return new DecodedRow(raw.timestamp(), raw.body(), raw.attributes(), Labels.fromMap(normalized));
    }

    Instant timestamp() {
        return timestamp;
    }

    String body() {
        return body;
    }

    Map<String, String> rawLabels() {
        return rawLabels;
    }

    Labels labels() {
        return labels;
    }

    String labelString() {
        return labelString;
    }
}
