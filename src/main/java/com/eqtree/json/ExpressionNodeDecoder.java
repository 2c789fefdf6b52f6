package com.eqtree.json;

import com.eqtree.expr.ExpressionNode;
import com.eqtree.model.Branch;
import com.eqtree.model.Equation;
import com.eqtree.model.EquationType;
import com.eqtree.model.Relation;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Reads the output schema back into equations and expression trees. Decoding what
 * {@link EquationSerializer} wrote yields structurally identical trees.
 */
public class ExpressionNodeDecoder {

    public ImmutableList<Equation> decodeDocument(JsonNode document) {
        return elements(field(object(document), "equations"), this::decodeEquation);
    }

    public Equation decodeEquation(JsonNode node) {
        JsonNode.JsonObject json = object(node);
        ImmutableList<Branch> branches = json.fields().containsKey("branches")
                ? elements(json.get("branches"), this::decodeBranch)
                : Lists.immutable.empty();
        return new Equation(
                (int) number(field(json, "id")).longValue(),
                string(json, "raw"),
                elements(field(json, "variables"), n -> ((JsonNode.JsonString) n).value()),
                EquationType.fromTag(string(json, "equation_type")),
                relation(string(json, "relation")),
                decode(field(json, "lhs")),
                decode(field(json, "rhs")),
                branches);
    }

    public Branch decodeBranch(JsonNode node) {
        JsonNode.JsonObject json = object(node);
        return new Branch(decode(field(json, "condition")), decode(field(json, "expression")));
    }

    public ExpressionNode decode(JsonNode node) {
        JsonNode.JsonObject json = object(node);
        String type = string(json, "type");
        return switch (type) {
            case EquationSerializer.CONSTANT -> constant(field(json, "value"));
            case EquationSerializer.VARIABLE -> new ExpressionNode.Variable(string(json, "name"));
            case EquationSerializer.SUM -> new ExpressionNode.Sum(elements(field(json, "terms"), this::decode));
            case EquationSerializer.PRODUCT -> new ExpressionNode.Product(elements(field(json, "factors"), this::decode));
            case EquationSerializer.POWER ->
                    new ExpressionNode.Power(decode(field(json, "base")), decode(field(json, "exponent")));
            case EquationSerializer.QUOTIENT ->
                    new ExpressionNode.Quotient(decode(field(json, "numerator")), decode(field(json, "denominator")));
            case EquationSerializer.ABSOLUTE_VALUE -> new ExpressionNode.AbsoluteValue(decode(field(json, "operand")));
            case EquationSerializer.FUNCTION_CALL -> new ExpressionNode.FunctionCall(
                    string(json, "name"), elements(field(json, "arguments"), this::decode));
            case EquationSerializer.RELATIONAL -> new ExpressionNode.Relational(
                    relation(string(json, "relation")), decode(field(json, "lhs")), decode(field(json, "rhs")));
            case EquationSerializer.FUNCTION_DEF ->
                    new ExpressionNode.FunctionDef(string(json, "name"), string(json, "variable"));
            case EquationSerializer.PIECEWISE ->
                    new ExpressionNode.Piecewise(elements(field(json, "branches"), this::decodeBranch));
            default -> throw new IllegalArgumentException("Unknown node type: " + type);
        };
    }

    private static ExpressionNode constant(JsonNode value) {
        if (value instanceof JsonNode.JsonString s) {
            return new ExpressionNode.Opaque(s.value());
        }
        if (value instanceof JsonNode.JsonNumber.JsonLong l) {
            return new ExpressionNode.Constant(BigDecimal.valueOf(l.value()));
        }
        if (value instanceof JsonNode.JsonNumber.JsonDecimal d) {
            return new ExpressionNode.Constant(d.value());
        }
        throw new IllegalArgumentException("Constant value must be a number or a string");
    }

    private static Relation relation(String symbol) {
        return Relation.fromSymbol(symbol)
                .orElseThrow(() -> new IllegalArgumentException("Unknown relation: " + symbol));
    }

    private static <T> ImmutableList<T> elements(JsonNode node, Function<JsonNode, T> decode) {
        if (!(node instanceof JsonNode.JsonArray array)) {
            throw new IllegalArgumentException("Expected a JSON array but got " + node.getClass().getSimpleName());
        }
        return array.elements().collect(decode::apply).toImmutable();
    }

    private static JsonNode.JsonObject object(JsonNode node) {
        if (!(node instanceof JsonNode.JsonObject json)) {
            throw new IllegalArgumentException("Expected a JSON object but got "
                    + (node == null ? "nothing" : node.getClass().getSimpleName()));
        }
        return json;
    }

    private static JsonNode field(JsonNode.JsonObject json, String name) {
        JsonNode value = json.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing field '" + name + "'");
        }
        return value;
    }

    private static String string(JsonNode.JsonObject json, String name) {
        if (!(field(json, name) instanceof JsonNode.JsonString s)) {
            throw new IllegalArgumentException("Field '" + name + "' must be a string");
        }
        return s.value();
    }

    private static Number number(JsonNode node) {
        if (!(node instanceof JsonNode.JsonNumber n)) {
            throw new IllegalArgumentException("Expected a number but got " + node.getClass().getSimpleName());
        }
        return n.numberValue();
    }
}
