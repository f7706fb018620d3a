package com.vortex.logql;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Parser stage extracting labels from the line: {@code | json},
 * {@code | logfmt}, {@code | regexp "(?P<status>\\d+)"}.
 *
 * <p>Parsed labels only exist after the line has been read, so this stage has
 * no SQL counterpart and is skipped by the generator.
 */
public final class LabelParserExpr implements StageExpr {

    private final String parser;
    private final String params;

    /**
     * Creates a parser stage.
     *
     * @param parser the parser name
     * @param params the parser argument, or an empty string
     */
    public LabelParserExpr(String parser, String params) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.params = Objects.requireNonNull(params, "params must not be null");
    }

    public static LabelParserExpr json() {
        return new LabelParserExpr("json", "");
    }

    public static LabelParserExpr logfmt() {
        return new LabelParserExpr("logfmt", "");
    }

    public String parser() {
        return parser;
    }

    public String params() {
        return params;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        if (params.isEmpty()) {
            return "| " + parser;
        }
        return "| " + parser + " " + LogQLStrings.quote(params);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LabelParserExpr)) return false;
        LabelParserExpr that = (LabelParserExpr) obj;
        return parser.equals(that.parser) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parser, params);
    }
}
