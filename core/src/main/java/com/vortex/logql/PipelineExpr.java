package com.vortex.logql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A stream selector followed by one or more pipeline stages.
 *
 * <p>Example:
 * <pre>
 *   {service_name="api"} |= "error" | json
 * </pre>
 *
 * <p>{@link #walk(Consumer)} visits this node, then the selector, then each
 * stage in order.
 */
public final class PipelineExpr implements LogSelectorExpr {

    private final MatchersExpr left;
    private final List<StageExpr> stages;

    /**
     * Creates a pipeline.
     *
     * @param left the stream selector
     * @param stages the stages applied to the selected lines
     */
    public PipelineExpr(MatchersExpr left, List<StageExpr> stages) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.stages = new ArrayList<>(Objects.requireNonNull(stages, "stages must not be null"));
    }

    public static PipelineExpr of(MatchersExpr left, StageExpr... stages) {
        return new PipelineExpr(left, List.of(stages));
    }

    public MatchersExpr left() {
        return left;
    }

    public List<StageExpr> stages() {
        return Collections.unmodifiableList(stages);
    }

    @Override
    public List<Matcher> matchers() {
        return left.matchers();
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
        for (StageExpr stage : stages) {
            stage.walk(visitor);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(left.toString());
        for (StageExpr stage : stages) {
            sb.append(' ').append(stage);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PipelineExpr)) return false;
        PipelineExpr that = (PipelineExpr) obj;
        return left.equals(that.left) && stages.equals(that.stages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, stages);
    }
}
