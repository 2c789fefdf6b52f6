package com.eqtree.model;

import com.eqtree.expr.ExpressionNode;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * One parsed input line. {@code branches} is empty unless the type is {@link EquationType#PIECEWISE}.
 */
public record Equation(
        int id,
        String raw,
        ImmutableList<String> variables,
        EquationType equationType,
        Relation relation,
        ExpressionNode lhs,
        ExpressionNode rhs,
        ImmutableList<Branch> branches) {

    public Equation {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(equationType, "equationType");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");
        Objects.requireNonNull(branches, "branches");
        if (!branches.isEmpty() && equationType != EquationType.PIECEWISE) {
            throw new IllegalArgumentException("Only piecewise equations carry branches");
        }
    }

    public boolean isPiecewise() {
        return equationType == EquationType.PIECEWISE;
    }
}
