package com.vortex.logql;

/**
 * A single stage of a log pipeline ({@code | json}, {@code |= "error"}).
 */
public interface StageExpr extends Expr {
}
