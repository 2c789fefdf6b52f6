package com.eqtree.expr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Numeric value of variable-free sub-trees. Sums, products and integer powers of exact
 * operands stay exact; division and transcendental functions are rounded to
 * {@link MathContext#DECIMAL128}. Integer powers whose exact result would be too large fall back
 * to rounded arithmetic; a value out of {@link BigDecimal} range has no value at all.
 */
public class ConstantEvaluator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConstantEvaluator.class);

    static final MathContext CONTEXT = MathContext.DECIMAL128;

    private static final int MAX_EXACT_EXPONENT = 999;
    static final long MAX_EXACT_DIGITS = 10_000;

    public Optional<BigDecimal> evaluate(ExpressionNode node) {
        try {
            return compute(node);
        } catch (ArithmeticException e) {
            LOGGER.trace("No numeric value for {}: {}", node, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> compute(ExpressionNode node) {
        if (node instanceof ExpressionNode.Constant c) {
            return Optional.of(c.value());
        }
        if (node instanceof ExpressionNode.Sum s) {
            BigDecimal total = BigDecimal.ZERO;
            for (ExpressionNode term : s.terms()) {
                Optional<BigDecimal> value = compute(term);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                total = total.add(value.get());
            }
            return Optional.of(total);
        }
        if (node instanceof ExpressionNode.Product p) {
            BigDecimal total = BigDecimal.ONE;
            for (ExpressionNode factor : p.factors()) {
                Optional<BigDecimal> value = compute(factor);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                total = total.multiply(value.get());
            }
            return Optional.of(total);
        }
        if (node instanceof ExpressionNode.Quotient q) {
            Optional<BigDecimal> numerator = compute(q.numerator());
            Optional<BigDecimal> denominator = compute(q.denominator());
            if (numerator.isEmpty() || denominator.isEmpty() || denominator.get().signum() == 0) {
                return Optional.empty();
            }
            return Optional.of(numerator.get().divide(denominator.get(), CONTEXT));
        }
        if (node instanceof ExpressionNode.Power p) {
            Optional<BigDecimal> base = compute(p.base());
            Optional<BigDecimal> exponent = compute(p.exponent());
            if (base.isEmpty() || exponent.isEmpty()) {
                return Optional.empty();
            }
            return power(base.get(), exponent.get());
        }
        if (node instanceof ExpressionNode.AbsoluteValue a) {
            return compute(a.operand()).map(BigDecimal::abs);
        }
        if (node instanceof ExpressionNode.FunctionCall f) {
            return function(f);
        }
        return Optional.empty();
    }

    public boolean isNumericallyEqual(ExpressionNode node, BigDecimal expected) {
        return evaluate(node).map(value -> value.compareTo(expected) == 0).orElse(false);
    }

    private Optional<BigDecimal> power(BigDecimal base, BigDecimal exponent) {
        if (exponent.stripTrailingZeros().scale() <= 0 && exponent.abs().compareTo(BigDecimal.valueOf(MAX_EXACT_EXPONENT)) <= 0) {
            int n = exponent.intValueExact();
            if (n < 0 && base.signum() == 0) {
                return Optional.empty();
            }
            if (!isSmallExactPower(base, Math.abs(n))) {
                return Optional.of(base.pow(n, CONTEXT));
            }
            if (n >= 0) {
                return Optional.of(base.pow(n));
            }
            return Optional.of(BigDecimal.ONE.divide(base.pow(-n), CONTEXT));
        }
        return finite(Math.pow(base.doubleValue(), exponent.doubleValue()));
    }

    /** Digits and scale of {@code base^n} both stay within {@link #MAX_EXACT_DIGITS}. */
    private static boolean isSmallExactPower(BigDecimal base, int n) {
        return (long) base.precision() * n <= MAX_EXACT_DIGITS
                && Math.abs((long) base.scale() * n) <= MAX_EXACT_DIGITS;
    }

    private Optional<BigDecimal> function(ExpressionNode.FunctionCall call) {
        double[] args = new double[call.arguments().size()];
        for (int i = 0; i < args.length; i++) {
            Optional<BigDecimal> value = compute(call.arguments().get(i));
            if (value.isEmpty()) {
                return Optional.empty();
            }
            args[i] = value.get().doubleValue();
        }
        if (args.length == 2 && call.name().equals("log")) {
            return finite(Math.log(args[0]) / Math.log(args[1]));
        }
        if (args.length != 1) {
            return Optional.empty();
        }
        double x = args[0];
        return switch (call.name()) {
            case "log" -> finite(Math.log(x));
            case "exp" -> finite(Math.exp(x));
            case "sin" -> finite(Math.sin(x));
            case "cos" -> finite(Math.cos(x));
            case "tan" -> finite(Math.tan(x));
            default -> Optional.empty();
        };
    }

    private static Optional<BigDecimal> finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(value, CONTEXT));
    }
}
