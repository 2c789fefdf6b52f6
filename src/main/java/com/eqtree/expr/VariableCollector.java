package com.eqtree.expr;

import com.eqtree.model.Branch;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.eclipse.collections.impl.factory.SortedSets;

/**
 * Gathers the free variable names of expression trees.
 */
public class VariableCollector {

    public MutableSortedSet<String> collect(ExpressionNode... nodes) {
        MutableSortedSet<String> names = SortedSets.mutable.empty();
        for (ExpressionNode node : nodes) {
            collectInto(node, names);
        }
        return names;
    }

    public boolean containsVariable(ExpressionNode node) {
        return !collect(node).isEmpty();
    }

    private void collectInto(ExpressionNode node, MutableSortedSet<String> names) {
        if (node instanceof ExpressionNode.Variable v) {
            names.add(v.name());
        } else if (node instanceof ExpressionNode.Sum s) {
            s.terms().each(term -> collectInto(term, names));
        } else if (node instanceof ExpressionNode.Product p) {
            p.factors().each(factor -> collectInto(factor, names));
        } else if (node instanceof ExpressionNode.Power p) {
            collectInto(p.base(), names);
            collectInto(p.exponent(), names);
        } else if (node instanceof ExpressionNode.Quotient q) {
            collectInto(q.numerator(), names);
            collectInto(q.denominator(), names);
        } else if (node instanceof ExpressionNode.AbsoluteValue a) {
            collectInto(a.operand(), names);
        } else if (node instanceof ExpressionNode.FunctionCall f) {
            f.arguments().each(argument -> collectInto(argument, names));
        } else if (node instanceof ExpressionNode.Relational r) {
            collectInto(r.lhs(), names);
            collectInto(r.rhs(), names);
        } else if (node instanceof ExpressionNode.FunctionDef def) {
            names.add(def.variable());
        } else if (node instanceof ExpressionNode.Piecewise pw) {
            for (Branch branch : pw.branches()) {
                collectInto(branch.condition(), names);
                collectInto(branch.expression(), names);
            }
        }
        // Constant and Opaque reference no variables
    }
}
