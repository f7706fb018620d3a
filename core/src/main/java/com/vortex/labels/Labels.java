package com.vortex.labels;

import com.vortex.logql.LogQLStrings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable label set sorted by name. Identifies a stream.
 *
 * <p>{@link #toString()} gives the canonical stream string:
 * <pre>
 *   {env="prod", service_name="api"}
 * </pre>
 * Two label sets with the same pairs always render to the same string,
 * whatever order they were built in.
 */
public final class Labels implements Iterable<Label> {

    private static final Labels EMPTY = new Labels(List.of());

    private final List<Label> labels;

    private Labels(List<Label> sorted) {
        this.labels = sorted;
    }

    public static Labels empty() {
        return EMPTY;
    }

    /**
     * Builds a label set from a map. Keys are used as given.
     *
     * @param map label names to values
     * @return the sorted label set
     */
    public static Labels fromMap(Map<String, String> map) {
        Objects.requireNonNull(map, "map must not be null");
        if (map.isEmpty()) {
            return EMPTY;
        }
        List<Label> sorted = new ArrayList<>(map.size());
        new TreeMap<>(map).forEach((name, value) -> sorted.add(new Label(name, value)));
        return new Labels(Collections.unmodifiableList(sorted));
    }

    /**
     * Builds a label set from alternating names and values.
     *
     * @param pairs name1, value1, name2, value2, ...
     * @return the sorted label set; a repeated name keeps its last value
     * @throws IllegalArgumentException if an odd number of strings is given
     */
    public static Labels of(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("Labels.of requires name/value pairs, got " + pairs.length + " strings");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return fromMap(map);
    }

    @Override
    public Iterator<Label> iterator() {
        return labels.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Label label = labels.get(i);
            sb.append(label.name()).append('=').append(LogQLStrings.quote(label.value()));
        }
        sb.append('}');
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Labels)) return false;
        return labels.equals(((Labels) obj).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }
}
