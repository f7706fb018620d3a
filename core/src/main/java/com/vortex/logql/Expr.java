package com.vortex.logql;

import java.util.function.Consumer;

/**
 * Base interface for all nodes of a parsed LogQL expression.
 *
 * <p>Node kinds understood by the SQL generator:
 * <ul>
 *   <li>{@link MatchersExpr} - the stream selector {@code {app="api"}}</li>
 *   <li>{@link PipelineExpr} - a selector followed by pipeline stages</li>
 *   <li>{@link LineFilterExpr} - {@code |= "error"}, {@code |~ "err.*"}</li>
 * </ul>
 *
 * <p>Other node kinds (for example {@link LabelParserExpr}) may appear in a
 * tree; consumers are expected to skip what they do not recognize.
 */
public interface Expr {

    /**
     * Visits this node and then every descendant, depth-first.
     *
     * @param visitor called once per node
     */
    void walk(Consumer<Expr> visitor);

    /**
     * Renders the node back to LogQL text.
     *
     * @return the LogQL representation
     */
    @Override
    String toString();
}
