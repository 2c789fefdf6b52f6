package com.eqtree.classify;

import com.eqtree.EquationParser;
import com.eqtree.expr.ExpressionNode;
import com.eqtree.expr.ExpressionNode.Constant;
import com.eqtree.expr.ExpressionNode.FunctionCall;
import com.eqtree.expr.ExpressionNode.Power;
import com.eqtree.expr.ExpressionNode.Variable;
import com.eqtree.model.EquationType;
import com.eqtree.model.ParseOutcome;
import com.eqtree.model.Relation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EquationClassifierTest {
    private final EquationParser parser = new EquationParser();
    private final EquationClassifier classifier = new EquationClassifier();

    private String classify(String line) {
        ParseOutcome outcome = parser.parseLine(line, 1);
        assertTrue(outcome instanceof ParseOutcome.Parsed, "Could not parse " + line + ": " + outcome);
        return ((ParseOutcome.Parsed) outcome).equation().equationType().tag();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = ';', value = {
            "2x + 3 > 7                 ; inequality_linear",
            "x ≥ 3                      ; inequality_linear",
            "x + y < 1                  ; inequality_linear",
            "x^2 - 1 <= 0               ; inequality_polynomial",
            "x³ > 8                     ; inequality_polynomial",
            "log(x) > 1                 ; inequality",
            "1/x < 2                    ; inequality",
            "5 > 3                      ; inequality",
            "5 = 5                      ; constant",
            "2 * 3 = 7                  ; constant",
            "2**0.5 = log(3)            ; constant",
            "3x + 5 = 11                ; linear",
            "x/4 = 2                    ; linear",
            "x^2 + x = x^2 + 3          ; linear",
            "2x + 3y = 6                ; linear",
            "x^2 - 4 = 0                ; quadratic",
            "(x-1)(x+2) = 0             ; quadratic",
            "x*y = 1                    ; quadratic",
            "x^3 + x = 2                ; polynomial",
            "(x + 1)^4 = 16             ; polynomial",
            "2^x = 8                    ; exponential",
            "3**(x + 1) = 27            ; exponential",
            "log(x) = 2                 ; logarithmic",
            "ln(x) = 1                  ; logarithmic",
            "3log(x) = 6                ; logarithmic",
            "sqrt(2x + 1) = 3           ; radical",
            "(2x + 1)^0.5 = 3           ; radical",
            "x**-2 = 4                  ; power",
            "1/x = 2                    ; power",
            "x/(x + 1) = 2              ; rational",
            "3 + 1/x = 2                ; rational",
            "|2x - 1| = 5               ; absolute",
            "f(x) = 3                   ; functional",
            "sin(x) = cos(x)            ; identity",
            "sin(x) = 1                 ; other",
            "2^x + 1 = 9                ; other"
    })
    public void testClassification(String line, String expectedTag) {
        assertEquals(expectedTag, classify(line));
    }

    @Test
    public void testPiecewiseBypassesCascade() {
        assertEquals("piecewise", classify("f(x) = { x^2 , x > 0 ; 1/x , x <= 0 }"));
    }

    @Test
    public void testInequalityRulesComeFirst() {
        // a power of a numeric base would be exponential under "="
        ExpressionNode lhs = new Power(Constant.of(2), new Variable("x"));
        assertEquals(EquationType.INEQUALITY, classifier.classify(lhs, Constant.of(8), Relation.GT, Set.of("x")));
        assertEquals(EquationType.EXPONENTIAL, classifier.classify(lhs, Constant.of(8), Relation.EQ, Set.of("x")));
    }

    @Test
    public void testLogarithmWithoutVariablesIsACoefficient() {
        ExpressionNode lhs = ExpressionNode.Product.of(FunctionCall.of("log", Constant.of(2)), new Variable("x"));
        assertEquals(EquationType.LINEAR, classifier.classify(lhs, Constant.of(1), Relation.EQ, Set.of("x")));
    }

    @Test
    public void testRadicalNeedsExponentOneHalf() {
        ExpressionNode cubeRoot = new Power(new Variable("x"), new ExpressionNode.Quotient(Constant.of(1), Constant.of(3)));
        assertEquals(EquationType.OTHER, classifier.classify(cubeRoot, Constant.of(2), Relation.EQ, Set.of("x")));

        ExpressionNode squareRoot = new Power(new Variable("x"), Constant.of("0.50"));
        assertEquals(EquationType.RADICAL, classifier.classify(squareRoot, Constant.of(2), Relation.EQ, Set.of("x")));
    }
}
