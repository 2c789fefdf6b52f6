package com.eqtree.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Computes the total degree of an expression viewed as a polynomial in a set of variables.
 * <p>
 * The expression is expanded into monomials so that cancelling terms ({@code x^2 + x - x^2})
 * do not inflate the degree. Analysis is unavailable when a variable sits in a denominator,
 * under a negative or non-integer exponent, in an exponent, or inside a function call or
 * absolute value. Variable-free sub-trees are treated as numeric coefficients.
 */
public class DegreeAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DegreeAnalyzer.class);

    static final int MAX_EXPONENT = 1000;

    private final ConstantEvaluator evaluator = new ConstantEvaluator();
    private final VariableCollector collector = new VariableCollector();

    /**
     * Degree of {@code lhs - rhs}. Empty when the variable set is empty or the difference has no
     * polynomial form.
     */
    public OptionalInt degree(ExpressionNode lhs, ExpressionNode rhs, Set<String> variables) {
        return degree(ExpressionNode.Sum.of(lhs, ExpressionNode.Product.negate(rhs)), variables);
    }

    public OptionalInt degree(ExpressionNode expression, Set<String> variables) {
        if (variables.isEmpty()) {
            return OptionalInt.empty();
        }
        ImmutableList<String> order = Lists.immutable.withAll(variables);
        Optional<Polynomial> polynomial;
        try {
            polynomial = toPolynomial(expression, order);
        } catch (ArithmeticException e) {
            // coefficient arithmetic left the BigDecimal scale range
            LOGGER.trace("Coefficients out of range in {}: {}", expression, e.getMessage());
            return OptionalInt.empty();
        }
        if (polynomial.isEmpty()) {
            LOGGER.trace("No polynomial form in {} for {}", order, expression);
            return OptionalInt.empty();
        }
        return OptionalInt.of(polynomial.get().degree());
    }

    private Optional<Polynomial> toPolynomial(ExpressionNode node, ImmutableList<String> order) {
        int arity = order.size();
        if (!collector.containsVariable(node)) {
            return evaluator.evaluate(node).map(value -> Polynomial.constant(arity, value));
        }
        if (node instanceof ExpressionNode.Variable v) {
            int index = order.indexOf(v.name());
            return index < 0 ? Optional.empty() : Optional.of(Polynomial.variable(arity, index));
        }
        if (node instanceof ExpressionNode.Sum s) {
            Polynomial total = Polynomial.constant(arity, BigDecimal.ZERO);
            for (ExpressionNode term : s.terms()) {
                Optional<Polynomial> p = toPolynomial(term, order);
                if (p.isEmpty()) {
                    return Optional.empty();
                }
                total = total.add(p.get());
            }
            return Optional.of(total);
        }
        if (node instanceof ExpressionNode.Product p) {
            Optional<Polynomial> total = Optional.of(Polynomial.constant(arity, BigDecimal.ONE));
            for (ExpressionNode factor : p.factors()) {
                Optional<Polynomial> f = toPolynomial(factor, order);
                if (f.isEmpty() || total.isEmpty()) {
                    return Optional.empty();
                }
                total = total.get().multiply(f.get());
            }
            return total;
        }
        if (node instanceof ExpressionNode.Quotient q) {
            if (collector.containsVariable(q.denominator())) {
                return Optional.empty();
            }
            Optional<BigDecimal> denominator = evaluator.evaluate(q.denominator());
            if (denominator.isEmpty() || denominator.get().signum() == 0) {
                return Optional.empty();
            }
            BigDecimal reciprocal = BigDecimal.ONE.divide(denominator.get(), ConstantEvaluator.CONTEXT);
            return toPolynomial(q.numerator(), order).map(n -> n.scale(reciprocal));
        }
        if (node instanceof ExpressionNode.Power p) {
            if (collector.containsVariable(p.exponent())) {
                return Optional.empty();
            }
            Optional<BigDecimal> exponent = evaluator.evaluate(p.exponent());
            if (exponent.isEmpty() || !isSmallNaturalNumber(exponent.get())) {
                return Optional.empty();
            }
            return toPolynomial(p.base(), order).flatMap(base -> base.pow(exponent.get().intValueExact()));
        }
        // a variable under abs(), a function call, a relation or opaque text
        return Optional.empty();
    }

    private static boolean isSmallNaturalNumber(BigDecimal value) {
        return value.signum() >= 0
                && value.stripTrailingZeros().scale() <= 0
                && value.compareTo(BigDecimal.valueOf(MAX_EXPONENT)) <= 0;
    }
}
