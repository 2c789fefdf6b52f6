package com.eqtree.expr;

import com.eqtree.model.Branch;
import com.eqtree.model.Relation;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.util.Objects;

public sealed interface ExpressionNode {

    /**
     * Numeric literal. The value is kept exact and stripped of trailing zeros, so
     * {@code 2.50} and {@code 2.5} are the same constant.
     */
    record Constant(BigDecimal value) implements ExpressionNode {
        public static final Constant ZERO = of(0);
        public static final Constant ONE = of(1);
        public static final Constant MINUS_ONE = of(-1);

        public Constant {
            Objects.requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        public static Constant of(long value) {
            return new Constant(BigDecimal.valueOf(value));
        }

        public static Constant of(String literal) {
            return new Constant(new BigDecimal(literal));
        }

        public boolean isInteger() {
            return value.scale() <= 0;
        }

        public Constant negate() {
            return new Constant(value.negate());
        }
    }

    /** Unparsed source text standing in for a piecewise branch half that failed to parse. */
    record Opaque(String text) implements ExpressionNode {
        public Opaque {
            Objects.requireNonNull(text, "text");
        }
    }

    record Variable(String name) implements ExpressionNode {
        public Variable {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Commutative sum. Nested sums are flattened on construction; equality ignores term order.
     */
    record Sum(ImmutableList<ExpressionNode> terms) implements ExpressionNode {
        public Sum {
            terms = flatten(terms, Sum.class);
        }

        public static Sum of(ExpressionNode... terms) {
            return new Sum(Lists.immutable.of(terms));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Sum other && terms.toBag().equals(other.terms.toBag());
        }

        @Override
        public int hashCode() {
            return terms.toBag().hashCode();
        }
    }

    /**
     * Commutative product. Nested products are flattened on construction; equality ignores factor order.
     */
    record Product(ImmutableList<ExpressionNode> factors) implements ExpressionNode {
        public Product {
            factors = flatten(factors, Product.class);
        }

        public static Product of(ExpressionNode... factors) {
            return new Product(Lists.immutable.of(factors));
        }

        public static Product negate(ExpressionNode node) {
            return of(Constant.MINUS_ONE, node);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || o instanceof Product other && factors.toBag().equals(other.factors.toBag());
        }

        @Override
        public int hashCode() {
            return factors.toBag().hashCode();
        }
    }

    record Power(ExpressionNode base, ExpressionNode exponent) implements ExpressionNode {
        public Power {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }
    }

    record Quotient(ExpressionNode numerator, ExpressionNode denominator) implements ExpressionNode {
        public Quotient {
            Objects.requireNonNull(numerator, "numerator");
            Objects.requireNonNull(denominator, "denominator");
        }
    }

    record AbsoluteValue(ExpressionNode operand) implements ExpressionNode {
        public AbsoluteValue {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record FunctionCall(String name, ImmutableList<ExpressionNode> arguments) implements ExpressionNode {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(arguments, "arguments");
        }

        public static FunctionCall of(String name, ExpressionNode... arguments) {
            return new FunctionCall(name, Lists.immutable.of(arguments));
        }
    }

    record Relational(Relation relation, ExpressionNode lhs, ExpressionNode rhs) implements ExpressionNode {
        public Relational {
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }
    }

    /** Left-hand side of a piecewise definition, e.g. {@code f(x)}. */
    record FunctionDef(String name, String variable) implements ExpressionNode {}

    record Piecewise(ImmutableList<Branch> branches) implements ExpressionNode {
        public Piecewise {
            Objects.requireNonNull(branches, "branches");
        }
    }

    private static ImmutableList<ExpressionNode> flatten(ImmutableList<ExpressionNode> children,
                                                         Class<? extends ExpressionNode> kind) {
        Objects.requireNonNull(children, kind.getSimpleName().toLowerCase() + " children");
        if (children.noneSatisfy(kind::isInstance)) {
            return children;
        }
        MutableList<ExpressionNode> flat = Lists.mutable.empty();
        for (ExpressionNode child : children) {
            if (child instanceof Sum sum && kind == Sum.class) {
                flat.addAllIterable(sum.terms());
            } else if (child instanceof Product product && kind == Product.class) {
                flat.addAllIterable(product.factors());
            } else {
                flat.add(child);
            }
        }
        return flat.toImmutable();
    }
}
