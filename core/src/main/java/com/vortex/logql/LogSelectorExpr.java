package com.vortex.logql;

import java.util.List;

/**
 * An expression that selects log lines: a stream selector, optionally
 * followed by a pipeline.
 */
public interface LogSelectorExpr extends Expr {

    /**
     * Returns the label matchers of the stream selector.
     *
     * @return an unmodifiable list of matchers
     */
    List<Matcher> matchers();
}
