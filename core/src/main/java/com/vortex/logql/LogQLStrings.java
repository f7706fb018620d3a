package com.vortex.logql;

/**
 * String quoting shared by the LogQL renderers and the label set string.
 *
 * <p>Produces a double-quoted literal the LogQL parser reads back unchanged:
 * <pre>
 *   quote("api")        -&gt; "api"
 *   quote("say \"hi\"") -&gt; "say \"hi\""
 *   quote("a\nb")       -&gt; "a\nb"   (escaped, on one line)
 * </pre>
 */
public final class LogQLStrings {

    private LogQLStrings() {} // Utility class

    /**
     * Quotes a value with double quotes, escaping backslashes, quotes and
     * control characters.
     *
     * @param value the raw value
     * @return the quoted literal
     * @throws NullPointerException if value is null
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
