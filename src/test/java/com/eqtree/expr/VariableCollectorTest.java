package com.eqtree.expr;

import com.eqtree.expr.ExpressionNode.Constant;
import com.eqtree.expr.ExpressionNode.Variable;
import com.eqtree.model.Branch;
import com.eqtree.model.Relation;
import com.eqtree.parse.ExpressionParser;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VariableCollectorTest {
    private final VariableCollector collector = new VariableCollector();
    private final ExpressionParser parser = new ExpressionParser();

    @Test
    public void testCollectsThroughEveryNodeKind() {
        ExpressionNode node = parser.parse("a + b*c**d - e/f + abs(g) + log(h, 2)");
        assertEquals(List.of("a", "b", "c", "d", "e", "f", "g", "h"), collector.collect(node).toList());
    }

    @Test
    public void testUnionOfSeveralTreesIsSortedAndDistinct() {
        assertEquals(List.of("X", "x", "y"),
                collector.collect(parser.parse("y + x"), parser.parse("x*X")).toList());
    }

    @Test
    public void testConstantsContributeNothing() {
        assertTrue(collector.collect(parser.parse("2 + 3*4")).isEmpty());
        assertFalse(collector.containsVariable(new ExpressionNode.Opaque("x + 1")));
        assertTrue(collector.containsVariable(new Variable("x")));
    }

    @Test
    public void testPiecewiseNodes() {
        ExpressionNode piecewise = new ExpressionNode.Piecewise(Lists.immutable.of(
                new Branch(new ExpressionNode.Relational(Relation.GT, new Variable("x"), Constant.of(0)),
                        new Variable("a"))));
        assertEquals(List.of("a", "x"), collector.collect(piecewise).toList());
        assertEquals(List.of("x"), collector.collect(new ExpressionNode.FunctionDef("f", "x")).toList());
    }
}
