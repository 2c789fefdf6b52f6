package com.eqtree.json;

import com.eqtree.expr.ExpressionNode;
import com.eqtree.model.Branch;
import com.eqtree.model.Equation;
import com.eqtree.model.ParseBatch;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Renders equations and expression trees into the output schema. Every expression node becomes an
 * object whose {@code type} field names the node kind.
 */
public class EquationSerializer {
    public static final String CONSTANT = "constant";
    public static final String VARIABLE = "variable";
    public static final String SUM = "sum";
    public static final String PRODUCT = "product";
    public static final String POWER = "power";
    public static final String QUOTIENT = "quotient";
    public static final String ABSOLUTE_VALUE = "absolute_value";
    public static final String FUNCTION_CALL = "function_call";
    public static final String RELATIONAL = "relational";
    public static final String PIECEWISE = "piecewise";
    public static final String FUNCTION_DEF = "function_def";

    /** {@code {count, equations}}, preceded by {@code source_file} when a name is given. */
    public JsonNode.JsonObject toJson(ParseBatch batch, String sourceFile) {
        JsonNode.JsonObject document = JsonNode.JsonObject.empty();
        if (sourceFile != null) {
            document = document.with("source_file", sourceFile);
        }
        return document
                .with("count", JsonNode.JsonNumber.of(batch.count()))
                .with("equations", array(batch.equations(), this::toJson));
    }

    public JsonNode.JsonObject toJson(Equation equation) {
        JsonNode.JsonObject json = JsonNode.JsonObject.empty()
                .with("id", JsonNode.JsonNumber.of(equation.id()))
                .with("raw", equation.raw())
                .with("variables", array(equation.variables(), JsonNode.JsonString::new))
                .with("equation_type", equation.equationType().tag())
                .with("relation", equation.relation().symbol())
                .with("lhs", toJson(equation.lhs()))
                .with("rhs", toJson(equation.rhs()));
        if (equation.isPiecewise()) {
            json = json.with("branches", array(equation.branches(), this::toJson));
        }
        return json;
    }

    public JsonNode.JsonObject toJson(Branch branch) {
        return JsonNode.JsonObject.empty()
                .with("condition", toJson(branch.condition()))
                .with("expression", toJson(branch.expression()));
    }

    public JsonNode.JsonObject toJson(ExpressionNode node) {
        if (node instanceof ExpressionNode.Constant c) {
            return typed(CONSTANT).with("value", number(c.value()));
        }
        if (node instanceof ExpressionNode.Opaque o) {
            return typed(CONSTANT).with("value", o.text());
        }
        if (node instanceof ExpressionNode.Variable v) {
            return typed(VARIABLE).with("name", v.name());
        }
        if (node instanceof ExpressionNode.Sum s) {
            return typed(SUM).with("terms", array(s.terms(), this::toJson));
        }
        if (node instanceof ExpressionNode.Product p) {
            return typed(PRODUCT).with("factors", array(p.factors(), this::toJson));
        }
        if (node instanceof ExpressionNode.Power p) {
            return typed(POWER).with("base", toJson(p.base())).with("exponent", toJson(p.exponent()));
        }
        if (node instanceof ExpressionNode.Quotient q) {
            return typed(QUOTIENT)
                    .with("numerator", toJson(q.numerator()))
                    .with("denominator", toJson(q.denominator()));
        }
        if (node instanceof ExpressionNode.AbsoluteValue a) {
            return typed(ABSOLUTE_VALUE).with("operand", toJson(a.operand()));
        }
        if (node instanceof ExpressionNode.FunctionCall f) {
            return typed(FUNCTION_CALL).with("name", f.name()).with("arguments", array(f.arguments(), this::toJson));
        }
        if (node instanceof ExpressionNode.Relational r) {
            return typed(RELATIONAL)
                    .with("relation", r.relation().symbol())
                    .with("lhs", toJson(r.lhs()))
                    .with("rhs", toJson(r.rhs()));
        }
        if (node instanceof ExpressionNode.FunctionDef def) {
            return typed(FUNCTION_DEF).with("name", def.name()).with("variable", def.variable());
        }
        ExpressionNode.Piecewise pw = (ExpressionNode.Piecewise) node;
        return typed(PIECEWISE).with("branches", array(pw.branches(), this::toJson));
    }

    static JsonNode.JsonNumber number(BigDecimal value) {
        if (value.scale() <= 0 && value.precision() - value.scale() <= 18) {
            return JsonNode.JsonNumber.of(value.longValueExact());
        }
        return JsonNode.JsonNumber.of(value);
    }

    private static JsonNode.JsonObject typed(String type) {
        return JsonNode.JsonObject.empty().with("type", type);
    }

    private static <T> JsonNode.JsonArray array(ImmutableList<T> items, Function<? super T, ? extends JsonNode> render) {
        MutableList<JsonNode> elements = items.toList().collect(render::apply);
        return new JsonNode.JsonArray(elements);
    }
}
