package com.eqtree.model;

import com.eqtree.expr.ExpressionNode;

import java.util.Objects;

/**
 * One arm of a piecewise definition. The condition is normally a
 * {@link ExpressionNode.Relational}, or an opaque constant when it could not be parsed.
 */
public record Branch(ExpressionNode condition, ExpressionNode expression) {
    public Branch {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(expression, "expression");
    }
}
