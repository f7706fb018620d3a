package com.vortex.logql;

import java.util.Objects;

/**
 * A predicate constraining one label of a stream.
 *
 * <p>Examples:
 * <pre>
 *   service_name="api"
 *   env!="dev"
 *   pod=~"api-.*"
 * </pre>
 *
 * <p>The name is in query-side form ({@code service_name}); translating it to
 * the storage key ({@code service.name}) is the job of the SQL generator.
 */
public final class Matcher {

    private final String name;
    private final MatchType type;
    private final String value;

    /**
     * Creates a matcher.
     *
     * @param name the label name
     * @param type the comparison
     * @param value the literal value or regular expression
     */
    public Matcher(String name, MatchType type, String value) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public static Matcher equal(String name, String value) {
        return new Matcher(name, MatchType.EQUAL, value);
    }

    public static Matcher notEqual(String name, String value) {
        return new Matcher(name, MatchType.NOT_EQUAL, value);
    }

    public static Matcher regex(String name, String pattern) {
        return new Matcher(name, MatchType.REGEX_MATCH, pattern);
    }

    public static Matcher notRegex(String name, String pattern) {
        return new Matcher(name, MatchType.REGEX_NOT_MATCH, pattern);
    }

    public String name() {
        return name;
    }

    public MatchType type() {
        return type;
    }

    public String value() {
        return value;
    }

    /**
     * Returns the regular expression of a regex matcher.
     *
     * @return the pattern, or an empty string for equality matchers
     */
    public String regexString() {
        return type.isRegex() ? value : "";
    }

    /**
     * Returns true when the matcher carries neither a value nor a pattern and
     * therefore constrains nothing.
     *
     * @return true for a no-op matcher
     */
    public boolean isEmpty() {
        return value.isEmpty() && regexString().isEmpty();
    }

    @Override
    public String toString() {
        return name + type.labelSymbol() + LogQLStrings.quote(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matcher)) return false;
        Matcher that = (Matcher) obj;
        return name.equals(that.name) &&
               type == that.type &&
               value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value);
    }
}
