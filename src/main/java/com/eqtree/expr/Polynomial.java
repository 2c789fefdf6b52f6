package com.eqtree.expr;

import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Sparse multivariate polynomial over a fixed number of variables. Each monomial is keyed by
 * its exponent vector; zero coefficients are never stored.
 */
final class Polynomial {
    static final int MAX_TERMS = 4096;

    private final int arity;
    private final MutableMap<ImmutableIntList, BigDecimal> terms;

    private Polynomial(int arity, MutableMap<ImmutableIntList, BigDecimal> terms) {
        this.arity = arity;
        this.terms = terms;
    }

    static Polynomial constant(int arity, BigDecimal value) {
        MutableMap<ImmutableIntList, BigDecimal> terms = Maps.mutable.empty();
        if (value.signum() != 0) {
            terms.put(zeroExponents(arity), value);
        }
        return new Polynomial(arity, terms);
    }

    static Polynomial variable(int arity, int index) {
        MutableIntList exponents = IntLists.mutable.withAll(zeroExponents(arity));
        exponents.set(index, 1);
        MutableMap<ImmutableIntList, BigDecimal> terms = Maps.mutable.empty();
        terms.put(exponents.toImmutable(), BigDecimal.ONE);
        return new Polynomial(arity, terms);
    }

    Polynomial add(Polynomial other) {
        MutableMap<ImmutableIntList, BigDecimal> sum = Maps.mutable.ofMap(terms);
        other.terms.forEachKeyValue((monomial, coefficient) -> accumulate(sum, monomial, coefficient));
        return new Polynomial(arity, sum);
    }

    /** Returns empty when the expanded product would exceed {@link #MAX_TERMS} monomials. */
    Optional<Polynomial> multiply(Polynomial other) {
        MutableMap<ImmutableIntList, BigDecimal> product = Maps.mutable.empty();
        for (Map.Entry<ImmutableIntList, BigDecimal> left : terms.entrySet()) {
            for (Map.Entry<ImmutableIntList, BigDecimal> right : other.terms.entrySet()) {
                MutableIntList exponents = IntLists.mutable.empty();
                for (int i = 0; i < arity; i++) {
                    exponents.add(left.getKey().get(i) + right.getKey().get(i));
                }
                accumulate(product, exponents.toImmutable(), left.getValue().multiply(right.getValue()));
            }
            if (product.size() > MAX_TERMS) {
                return Optional.empty();
            }
        }
        return Optional.of(new Polynomial(arity, product));
    }

    Optional<Polynomial> pow(int exponent) {
        Optional<Polynomial> result = Optional.of(constant(arity, BigDecimal.ONE));
        for (int i = 0; i < exponent && result.isPresent(); i++) {
            result = result.get().multiply(this);
        }
        return result;
    }

    Polynomial scale(BigDecimal factor) {
        return multiply(constant(arity, factor)).orElseThrow();
    }

    /** Highest total exponent among the non-zero monomials; the zero polynomial has degree 0. */
    int degree() {
        return terms.keysView().collectInt(monomial -> (int) monomial.sum()).maxIfEmpty(0);
    }

    private static void accumulate(MutableMap<ImmutableIntList, BigDecimal> target,
                                   ImmutableIntList monomial, BigDecimal coefficient) {
        BigDecimal updated = target.getIfAbsentValue(monomial, BigDecimal.ZERO).add(coefficient);
        if (updated.signum() == 0) {
            target.remove(monomial);
        } else {
            target.put(monomial, updated);
        }
    }

    private static ImmutableIntList zeroExponents(int arity) {
        return IntLists.immutable.with(new int[arity]);
    }
}
