package com.vortex.generator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL text together with the values bound to its {@code ?}
 * placeholders, in placeholder order.
 *
 * <p>Literal values never appear in the text. Fragments are combined by
 * appending text and arguments together, so placeholder order and argument
 * order cannot drift apart:
 * <pre>
 *   SQLFragment key = SQLFragment.of("arrayElement(`ResourceAttributes`, ?)", "service.name");
 *   SQLFragment eq  = key.append(" = ?", "api");
 *   // text: arrayElement(`ResourceAttributes`, ?) = ?
 *   // args: [service.name, api]
 * </pre>
 *
 * <p>Instances are immutable.
 */
public final class SQLFragment {

    private final String text;
    private final List<Object> args;

    private SQLFragment(String text, List<Object> args) {
        this.text = text;
        this.args = args;
    }

    /**
     * Creates a fragment.
     *
     * @param text SQL text with one {@code ?} per argument
     * @param args the bound values, in placeholder order
     * @return the fragment
     * @throws IllegalArgumentException if placeholders and arguments differ in number
     */
    public static SQLFragment of(String text, Object... args) {
        Objects.requireNonNull(text, "text must not be null");
        int placeholders = countPlaceholders(text);
        if (placeholders != args.length) {
            throw new IllegalArgumentException(
                "Fragment has " + placeholders + " placeholders but " + args.length + " arguments: " + text);
        }
        return new SQLFragment(text, args.length == 0
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))));
    }

    public String text() {
        return text;
    }

    /**
     * Returns the bound values.
     *
     * @return an unmodifiable list; elements may be null
     */
    public List<Object> args() {
        return args;
    }

    /**
     * Appends SQL text and its arguments.
     *
     * @param suffix SQL text with one {@code ?} per argument
     * @param suffixArgs the bound values of the suffix
     * @return a new fragment
     */
    public SQLFragment append(String suffix, Object... suffixArgs) {
        return append(of(suffix, suffixArgs));
    }

    /**
     * Appends another fragment.
     *
     * @param other the fragment to append
     * @return a new fragment
     */
    public SQLFragment append(SQLFragment other) {
        if (other.args.isEmpty()) {
            return new SQLFragment(text + other.text, args);
        }
        List<Object> merged = new ArrayList<>(args.size() + other.args.size());
        merged.addAll(args);
        merged.addAll(other.args);
        return new SQLFragment(text + other.text, Collections.unmodifiableList(merged));
    }

    /**
     * Wraps the fragment: {@code prefix + this + suffix}.
     *
     * @param prefix SQL text without placeholders
     * @param suffix SQL text with one {@code ?} per argument
     * @param suffixArgs the bound values of the suffix
     * @return a new fragment
     */
    public SQLFragment wrap(String prefix, String suffix, Object... suffixArgs) {
        return of(prefix).append(this).append(suffix, suffixArgs);
    }

    /**
     * Negates a boolean fragment.
     *
     * @return {@code NOT (this)}
     */
    public SQLFragment not() {
        return wrap("NOT (", ")");
    }

    /**
     * Joins fragments with a separator.
     *
     * @param separator SQL text without placeholders
     * @param fragments the fragments to join
     * @return the joined fragment, empty text if there is nothing to join
     */
    public static SQLFragment join(String separator, List<SQLFragment> fragments) {
        SQLFragment result = of("");
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                result = result.append(separator);
            }
            result = result.append(fragments.get(i));
        }
        return result;
    }

    private static int countPlaceholders(String text) {
        // '?' inside string literals and quoted identifiers is not a placeholder
        int count = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == '?') {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return text + " " + args;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SQLFragment)) return false;
        SQLFragment that = (SQLFragment) obj;
        return text.equals(that.text) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, args);
    }
}
