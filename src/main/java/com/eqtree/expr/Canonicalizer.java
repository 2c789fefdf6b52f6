package com.eqtree.expr;

import com.eqtree.model.Branch;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.util.function.BinaryOperator;

/**
 * Rewrites a parsed tree into canonical shape, bottom-up:
 * <ul>
 *     <li>nested sums and products are flattened into their parent;</li>
 *     <li>adjacent numeric constants inside a sum are added, inside a product multiplied;</li>
 *     <li>a product of exactly {@code -1} and one other constant is a negated constant term and
 *     stays as it is, so {@code x - 3} keeps {@code Sum(x, Product(-1, 3))}; any longer product
 *     folds its {@code -1} like every other constant;</li>
 *     <li>{@code n / k} for a constant {@code k} becomes {@code n * (1/k)} when {@code 1/k} is a
 *     terminating decimal, otherwise it stays a quotient;</li>
 *     <li>{@code n / d} for a non-constant {@code d} becomes {@code n * d^-1};</li>
 *     <li>a sum or product left with a single child collapses to that child.</li>
 * </ul>
 * Canonicalizing a canonical tree returns an equal tree.
 */
public class Canonicalizer {

    public ExpressionNode canonicalize(ExpressionNode node) {
        if (node instanceof ExpressionNode.Sum s) {
            return sum(s.terms().collect(this::canonicalize));
        }
        if (node instanceof ExpressionNode.Product p) {
            return product(p.factors().collect(this::canonicalize));
        }
        if (node instanceof ExpressionNode.Quotient q) {
            return quotient(canonicalize(q.numerator()), canonicalize(q.denominator()));
        }
        if (node instanceof ExpressionNode.Power p) {
            return new ExpressionNode.Power(canonicalize(p.base()), canonicalize(p.exponent()));
        }
        if (node instanceof ExpressionNode.AbsoluteValue a) {
            return new ExpressionNode.AbsoluteValue(canonicalize(a.operand()));
        }
        if (node instanceof ExpressionNode.FunctionCall f) {
            return new ExpressionNode.FunctionCall(f.name(), f.arguments().collect(this::canonicalize));
        }
        if (node instanceof ExpressionNode.Relational r) {
            return new ExpressionNode.Relational(r.relation(), canonicalize(r.lhs()), canonicalize(r.rhs()));
        }
        if (node instanceof ExpressionNode.Piecewise pw) {
            return new ExpressionNode.Piecewise(pw.branches().collect(
                    b -> new Branch(canonicalize(b.condition()), canonicalize(b.expression()))));
        }
        return node;
    }

    private ExpressionNode sum(ImmutableList<ExpressionNode> terms) {
        ImmutableList<ExpressionNode> flat = new ExpressionNode.Sum(terms).terms();
        return collapse(foldAdjacent(flat, BigDecimal::add), ExpressionNode.Constant.ZERO, true);
    }

    private ExpressionNode product(ImmutableList<ExpressionNode> factors) {
        ImmutableList<ExpressionNode> flat = new ExpressionNode.Product(factors).factors();
        if (flat.size() == 2
                && ExpressionNode.Constant.MINUS_ONE.equals(flat.getFirst())
                && flat.getLast() instanceof ExpressionNode.Constant) {
            return new ExpressionNode.Product(flat);
        }
        return collapse(foldAdjacent(flat, BigDecimal::multiply), ExpressionNode.Constant.ONE, false);
    }

    private ExpressionNode quotient(ExpressionNode numerator, ExpressionNode denominator) {
        if (denominator instanceof ExpressionNode.Constant k) {
            if (k.value().signum() == 0) {
                return new ExpressionNode.Quotient(numerator, denominator);
            }
            if (numerator instanceof ExpressionNode.Constant n) {
                BigDecimal exact = exactQuotient(n.value(), k.value());
                if (exact != null) {
                    return new ExpressionNode.Constant(exact);
                }
            }
            BigDecimal reciprocal = k.isInteger() ? exactQuotient(BigDecimal.ONE, k.value()) : null;
            if (reciprocal == null) {
                return new ExpressionNode.Quotient(numerator, denominator);
            }
            return product(Lists.immutable.<ExpressionNode>of(numerator, new ExpressionNode.Constant(reciprocal)));
        }

        ExpressionNode inverse;
        if (denominator instanceof ExpressionNode.Power p && p.exponent() instanceof ExpressionNode.Constant e) {
            inverse = new ExpressionNode.Power(p.base(), e.negate());
        } else {
            inverse = new ExpressionNode.Power(denominator, ExpressionNode.Constant.MINUS_ONE);
        }
        if (ExpressionNode.Constant.ONE.equals(numerator)) {
            return inverse;
        }
        return product(Lists.immutable.<ExpressionNode>of(numerator, inverse));
    }

    private static ImmutableList<ExpressionNode> foldAdjacent(ImmutableList<ExpressionNode> children,
                                                              BinaryOperator<BigDecimal> combine) {
        MutableList<ExpressionNode> folded = Lists.mutable.empty();
        for (ExpressionNode child : children) {
            if (child instanceof ExpressionNode.Constant c
                    && !folded.isEmpty()
                    && folded.getLast() instanceof ExpressionNode.Constant previous) {
                folded.set(folded.size() - 1, new ExpressionNode.Constant(combine.apply(previous.value(), c.value())));
            } else {
                folded.add(child);
            }
        }
        return folded.toImmutable();
    }

    private static ExpressionNode collapse(ImmutableList<ExpressionNode> children, ExpressionNode.Constant identity,
                                           boolean isSum) {
        if (children.isEmpty()) {
            return identity;
        }
        if (children.size() == 1) {
            return children.getFirst();
        }
        return isSum ? new ExpressionNode.Sum(children) : new ExpressionNode.Product(children);
    }

    /** {@code a / b} when it is a terminating decimal, otherwise {@code null}. */
    private static BigDecimal exactQuotient(BigDecimal a, BigDecimal b) {
        try {
            return a.divide(b);
        } catch (ArithmeticException nonTerminating) {
            return null;
        }
    }
}
