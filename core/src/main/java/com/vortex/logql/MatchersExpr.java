package com.vortex.logql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Stream selector: a group of label matchers that must all hold.
 *
 * <p>Example:
 * <pre>
 *   {service_name="api", env=~"prod|staging"}
 * </pre>
 */
public final class MatchersExpr implements LogSelectorExpr {

    private final List<Matcher> matchers;

    /**
     * Creates a stream selector.
     *
     * @param matchers the matchers, AND-ed together
     */
    public MatchersExpr(List<Matcher> matchers) {
        this.matchers = new ArrayList<>(Objects.requireNonNull(matchers, "matchers must not be null"));
    }

    public static MatchersExpr of(Matcher... matchers) {
        return new MatchersExpr(List.of(matchers));
    }

    @Override
    public List<Matcher> matchers() {
        return Collections.unmodifiableList(matchers);
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        return matchers.stream()
            .map(Matcher::toString)
            .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MatchersExpr)) return false;
        return matchers.equals(((MatchersExpr) obj).matchers);
    }

    @Override
    public int hashCode() {
        return matchers.hashCode();
    }
}
