package com.vortex.generator;

import com.vortex.exception.SQLGenerationException;
import com.vortex.labels.LabelNames;
import com.vortex.logql.Expr;
import com.vortex.logql.LineFilterExpr;
import com.vortex.logql.LogSelectorExpr;
import com.vortex.logql.MatchType;
import com.vortex.logql.Matcher;
import com.vortex.logql.MatchersExpr;
import com.vortex.logql.PipelineExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Translates LogQL nodes into WHERE conditions of a {@link SelectBuilder}.
 *
 * <p>Label matchers read the denormalized key out of the attribute map:
 * <pre>
 *   service_name="api"    lookup('service.name') = ?
 *   service_name!="api"   lookup('service.name') != ?
 *   service_name=~"a.*"   regex(lookup('service.name'), ?)
 *   service_name!~"a.*"   NOT (regex(lookup('service.name'), ?))
 * </pre>
 * Line filters test the body column:
 * <pre>
 *   |= "error"            Body LIKE '%error%'
 *   != "error"            Body NOT LIKE '%error%'
 *   |~ "err.*"            regex(Body, ?)
 *   !~ "err.*"            NOT (regex(Body, ?))
 * </pre>
 *
 * <p>A label matcher the dialect cannot express fails the translation; a line
 * filter the dialect cannot express is logged and skipped. Empty matchers and
 * empty line filters add nothing.
 *
 * <p>One transformer writes into one builder; it holds no other state.
 */
public final class LogQLTransformer {

    private static final Logger logger = LoggerFactory.getLogger(LogQLTransformer.class);

    private final SelectBuilder builder;
    private final SQLDialect dialect;
    private final String labelsColumn;
    private final String bodyColumn;

    /**
     * Creates a transformer.
     *
     * @param builder the statement receiving the conditions
     * @param dialect the target dialect
     * @param labelsColumn the quoted attribute map column
     * @param bodyColumn the quoted log line column
     */
    public LogQLTransformer(SelectBuilder builder, SQLDialect dialect, String labelsColumn, String bodyColumn) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.labelsColumn = Objects.requireNonNull(labelsColumn, "labelsColumn must not be null");
        this.bodyColumn = Objects.requireNonNull(bodyColumn, "bodyColumn must not be null");
    }

    /**
     * Adds the conditions of every node of a log selector, in one traversal.
     *
     * @param expr the selector
     * @throws SQLGenerationException if a label matcher cannot be expressed
     */
    public void acceptLogSelector(LogSelectorExpr expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        expr.walk(this::visit);
    }

    /**
     * Visitor dispatch for a single node. Unknown node kinds are skipped.
     */
    private void visit(Expr node) {
        if (node instanceof MatchersExpr matchersExpr) {
            acceptMatchers(matchersExpr);
        } else if (node instanceof LineFilterExpr lineFilter) {
            acceptLineFilter(lineFilter);
        } else if (node instanceof PipelineExpr) {
            // children are visited by the walk
            logger.debug("acceptLogSelector: pipeline {}", node);
        } else {
            logger.warn("acceptLogSelector: skipping unsupported {} '{}'",
                node.getClass().getSimpleName(), node);
        }
    }

    public void acceptMatchers(MatchersExpr expr) {
        for (Matcher matcher : expr.matchers()) {
            acceptMatcher(matcher, expr);
        }
    }

    /**
     * Adds the condition of one label matcher.
     *
     * @param matcher the matcher
     * @param context the expression the matcher belongs to, for error reporting; may be null
     * @throws SQLGenerationException if the dialect cannot express the match type
     */
    public void acceptMatcher(Matcher matcher, Expr context) {
        if (matcher.isEmpty()) {
            return;
        }

        if (!dialect.supports(matcher.type())) {
            throw new SQLGenerationException(
                "Invalid match type " + matcher.type() + " for dialect " + dialect.name() +
                " in matcher " + matcher, context);
        }

        SQLFragment key = dialect.mapElement(labelsColumn, LabelNames.denormalize(matcher.name()));
        SQLFragment condition = switch (matcher.type()) {
            case EQUAL -> key.append(" = ?", matcher.value());
            case NOT_EQUAL -> key.append(" != ?", matcher.value());
            case REGEX_MATCH -> dialect.regexMatch(key, matcher.regexString());
            case REGEX_NOT_MATCH -> dialect.regexMatch(key, matcher.regexString()).not();
        };
        builder.where(condition);
    }

    /**
     * Adds the condition of a line filter, or logs and skips it when the
     * dialect cannot express its match type.
     *
     * @param expr the line filter
     */
    public void acceptLineFilter(LineFilterExpr expr) {
        if (expr.match().isEmpty()) {
            return;
        }

        if (!dialect.supports(expr.type())) {
            logger.warn("acceptLineFilter: invalid match type {} for dialect {}, skipping '{}'",
                expr.type(), dialect.name(), expr);
            return;
        }

        SQLFragment body = SQLFragment.of(bodyColumn);
        MatchType type = expr.type();
        if (!type.isRegex()) {
            builder.where(dialect.contains(body, expr.match(), type.isNegated()));
            return;
        }
        SQLFragment regex = dialect.regexMatch(body, expr.match());
        builder.where(type.isNegated() ? regex.not() : regex);
    }
}
