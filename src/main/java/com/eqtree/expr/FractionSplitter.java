package com.eqtree.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Finds the denominator factors of an expression written over a common denominator: divisors of
 * quotients and bases raised to negative exponents, looking through sums, products and positive
 * integer powers but not into function arguments or absolute values.
 */
public class FractionSplitter {
    private final ConstantEvaluator evaluator = new ConstantEvaluator();

    public ImmutableList<ExpressionNode> denominators(ExpressionNode node) {
        MutableList<ExpressionNode> found = Lists.mutable.empty();
        collect(node, found);
        return found.toImmutable();
    }

    private void collect(ExpressionNode node, MutableList<ExpressionNode> found) {
        if (node instanceof ExpressionNode.Sum s) {
            s.terms().each(term -> collect(term, found));
        } else if (node instanceof ExpressionNode.Product p) {
            p.factors().each(factor -> collect(factor, found));
        } else if (node instanceof ExpressionNode.Quotient q) {
            collect(q.numerator(), found);
            found.add(q.denominator());
        } else if (node instanceof ExpressionNode.Power p) {
            Optional<BigDecimal> exponent = evaluator.evaluate(p.exponent());
            if (exponent.isEmpty()) {
                return;
            }
            int sign = exponent.get().signum();
            if (sign < 0) {
                BigDecimal positive = exponent.get().negate();
                found.add(positive.compareTo(BigDecimal.ONE) == 0
                        ? p.base()
                        : new ExpressionNode.Power(p.base(), new ExpressionNode.Constant(positive)));
            } else if (sign > 0) {
                collect(p.base(), found);
            }
        }
    }
}
