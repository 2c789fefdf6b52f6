package com.eqtree.classify;

import com.eqtree.expr.ConstantEvaluator;
import com.eqtree.expr.DegreeAnalyzer;
import com.eqtree.expr.ExpressionNode;
import com.eqtree.expr.FractionSplitter;
import com.eqtree.expr.VariableCollector;
import com.eqtree.model.EquationType;
import com.eqtree.model.Relation;

import java.math.BigDecimal;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Assigns an {@link EquationType} to a parsed relation. The rules form a strict priority
 * cascade: the first one that matches decides, later rules are never consulted.
 */
public class EquationClassifier {
    private static final BigDecimal ONE_HALF = new BigDecimal("0.5");

    private final DegreeAnalyzer degreeAnalyzer = new DegreeAnalyzer();
    private final FractionSplitter fractionSplitter = new FractionSplitter();
    private final VariableCollector variableCollector = new VariableCollector();
    private final ConstantEvaluator evaluator = new ConstantEvaluator();

    public EquationType classify(ExpressionNode lhs, ExpressionNode rhs, Relation relation, Set<String> variables) {
        OptionalInt degree = degreeAnalyzer.degree(lhs, rhs, variables);

        if (relation != Relation.EQ) {
            if (degree.isEmpty()) {
                return EquationType.INEQUALITY;
            }
            return degree.getAsInt() <= 1 ? EquationType.INEQUALITY_LINEAR : EquationType.INEQUALITY_POLYNOMIAL;
        }
        if (variables.isEmpty()) {
            return EquationType.CONSTANT;
        }
        if (degree.isPresent()) {
            int d = degree.getAsInt();
            if (d <= 1) {
                return EquationType.LINEAR;
            }
            return d == 2 ? EquationType.QUADRATIC : EquationType.POLYNOMIAL;
        }
        if (isExponential(lhs)) {
            return EquationType.EXPONENTIAL;
        }
        if (isLogarithmic(lhs)) {
            return EquationType.LOGARITHMIC;
        }
        if (lhs instanceof ExpressionNode.Power p && evaluator.isNumericallyEqual(p.exponent(), ONE_HALF)) {
            return EquationType.RADICAL;
        }
        if (lhs instanceof ExpressionNode.Power p && p.exponent() instanceof ExpressionNode.Constant e && e.isInteger()) {
            return EquationType.POWER;
        }
        if (hasVariableDenominator(lhs, rhs)) {
            return EquationType.RATIONAL;
        }
        if (lhs instanceof ExpressionNode.AbsoluteValue) {
            return EquationType.ABSOLUTE;
        }
        if (variables.size() >= 2) {
            OptionalInt retried = degreeAnalyzer.degree(lhs, rhs, variables);
            if (retried.isPresent() && retried.getAsInt() <= 1) {
                return EquationType.PARAMETRIC;
            }
        }
        if (lhs instanceof ExpressionNode.FunctionCall f && f.name().equals("f")) {
            return EquationType.FUNCTIONAL;
        }
        if (!(lhs instanceof ExpressionNode.Constant) && !(rhs instanceof ExpressionNode.Constant)) {
            return EquationType.IDENTITY;
        }
        return EquationType.OTHER;
    }

    private boolean isExponential(ExpressionNode lhs) {
        return lhs instanceof ExpressionNode.Power p
                && p.base() instanceof ExpressionNode.Constant
                && variableCollector.containsVariable(p.exponent());
    }

    private static boolean isLogarithmic(ExpressionNode lhs) {
        if (isLog(lhs)) {
            return true;
        }
        return lhs instanceof ExpressionNode.Product p && p.factors().anySatisfy(EquationClassifier::isLog);
    }

    private static boolean isLog(ExpressionNode node) {
        return node instanceof ExpressionNode.FunctionCall f && f.name().equals("log");
    }

    private boolean hasVariableDenominator(ExpressionNode lhs, ExpressionNode rhs) {
        ExpressionNode difference = ExpressionNode.Sum.of(lhs, ExpressionNode.Product.negate(rhs));
        return fractionSplitter.denominators(difference).anySatisfy(
                d -> !ExpressionNode.Constant.ONE.equals(d) && variableCollector.containsVariable(d));
    }
}
