package com.vortex.logql;

/**
 * Comparison applied by a label matcher or a line filter.
 *
 * <p>The same four operators are shared by both node kinds:
 * <pre>
 *   {app="api"}       EQUAL
 *   {app!="api"}      NOT_EQUAL
 *   {app=~"api.*"}    REGEX_MATCH
 *   {app!~"api.*"}    REGEX_NOT_MATCH
 *   |= "error"        EQUAL (substring containment on the line)
 *   != "debug"        NOT_EQUAL
 *   |~ "err(or)?"     REGEX_MATCH
 *   !~ "trace"        REGEX_NOT_MATCH
 * </pre>
 */
public enum MatchType {

    EQUAL("=", "|="),
    NOT_EQUAL("!=", "!="),
    REGEX_MATCH("=~", "|~"),
    REGEX_NOT_MATCH("!~", "!~");

    private final String labelSymbol;
    private final String lineSymbol;

    MatchType(String labelSymbol, String lineSymbol) {
        this.labelSymbol = labelSymbol;
        this.lineSymbol = lineSymbol;
    }

    /**
     * Returns the operator as written inside a stream selector.
     *
     * @return the label matcher symbol
     */
    public String labelSymbol() {
        return labelSymbol;
    }

    /**
     * Returns the operator as written in a line filter stage.
     *
     * @return the line filter symbol
     */
    public String lineSymbol() {
        return lineSymbol;
    }

    public boolean isRegex() {
        return this == REGEX_MATCH || this == REGEX_NOT_MATCH;
    }

    public boolean isNegated() {
        return this == NOT_EQUAL || this == REGEX_NOT_MATCH;
    }
}
