package com.vortex.labels;

/**
 * Conversion between query-side label names and storage-side attribute keys.
 *
 * <p>LogQL label names are identifiers ({@code service_name}); OpenTelemetry
 * stores resource attributes under dotted keys ({@code service.name}).
 * <pre>
 *   denormalize("service_name")  -&gt; "service.name"
 *   normalize("service.name")    -&gt; "service_name"
 *   normalize("k8s.pod.name")    -&gt; "k8s_pod_name"
 *   normalize("3scale.id")       -&gt; "key_3scale_id"
 *   normalize("_internal")       -&gt; "key_internal"
 * </pre>
 *
 * <p>The same {@link #normalize(String)} must be applied to keys used in
 * predicates and to keys returned in results, otherwise result label sets do
 * not match the selectors that produced them.
 */
public final class LabelNames {

    private LabelNames() {} // Utility class

    /**
     * Converts a query-side label name to the storage key form by replacing
     * every underscore with a dot.
     *
     * @param name the label name
     * @return the storage key
     */
    public static String denormalize(String name) {
        return name.replace('_', '.');
    }

    /**
     * Converts a storage key to a query-side label name.
     *
     * <p>Every code point that is neither a letter nor a digit becomes an
     * underscore. A result starting with a digit gets a {@code key_} prefix;
     * a result starting with a single underscore gets a {@code key} prefix.
     * Names starting with {@code __} are reserved and left alone.
     *
     * @param key the storage key
     * @return the label name, empty if the key is empty
     */
    public static String normalize(String key) {
        if (key.isEmpty()) {
            return key;
        }

        StringBuilder sb = new StringBuilder(key.length());
        key.codePoints().forEach(cp -> {
            if (Character.isLetter(cp) || Character.isDigit(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });
        String label = sb.toString();

        if (Character.isDigit(label.codePointAt(0))) {
            return "key_" + label;
        }
        if (label.startsWith("_") && !label.startsWith("__")) {
            return "key" + label;
        }
        return label;
    }
}
