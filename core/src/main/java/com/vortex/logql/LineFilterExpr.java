package com.vortex.logql;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Pipeline stage filtering on the log line text.
 *
 * <p>Examples:
 * <pre>
 *   |= "error"        line contains "error"
 *   != "healthcheck"  line does not contain "healthcheck"
 *   |~ "5\\d\\d"      line matches the regular expression
 *   !~ "debug|trace"  line does not match the regular expression
 * </pre>
 */
public final class LineFilterExpr implements StageExpr {

    private final MatchType type;
    private final String match;

    /**
     * Creates a line filter.
     *
     * @param type the comparison
     * @param match the substring or regular expression
     */
    public LineFilterExpr(MatchType type, String match) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.match = Objects.requireNonNull(match, "match must not be null");
    }

    public static LineFilterExpr contains(String text) {
        return new LineFilterExpr(MatchType.EQUAL, text);
    }

    public static LineFilterExpr notContains(String text) {
        return new LineFilterExpr(MatchType.NOT_EQUAL, text);
    }

    public static LineFilterExpr regex(String pattern) {
        return new LineFilterExpr(MatchType.REGEX_MATCH, pattern);
    }

    public static LineFilterExpr notRegex(String pattern) {
        return new LineFilterExpr(MatchType.REGEX_NOT_MATCH, pattern);
    }

    public MatchType type() {
        return type;
    }

    public String match() {
        return match;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        return type.lineSymbol() + " " + LogQLStrings.quote(match);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LineFilterExpr)) return false;
        LineFilterExpr that = (LineFilterExpr) obj;
        return type == that.type && match.equals(that.match);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, match);
    }
}
