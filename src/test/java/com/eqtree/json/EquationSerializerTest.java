package com.eqtree.json;

import com.eqtree.EquationParser;
import com.eqtree.expr.ExpressionNode;
import com.eqtree.model.Equation;
import com.eqtree.model.ParseBatch;
import com.eqtree.model.ParseOutcome;
import com.eqtree.output.OutputFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EquationSerializerTest {
    private final EquationParser parser = new EquationParser();
    private final EquationSerializer serializer = new EquationSerializer();
    private final ExpressionNodeDecoder decoder = new ExpressionNodeDecoder();
    private final JsonReader reader = new JsonReader();

    private Equation parse(String line) {
        ParseOutcome outcome = parser.parseLine(line, 1);
        assertTrue(outcome instanceof ParseOutcome.Parsed, "Could not parse " + line + ": " + outcome);
        return ((ParseOutcome.Parsed) outcome).equation();
    }

    @Test
    public void testCompactLinearEquation() {
        String json = new OutputFormatter(false).format(serializer.toJson(parse("3x + 5 = 11")));

        assertEquals("{\"id\":1,\"raw\":\"3x + 5 = 11\",\"variables\":[\"x\"],\"equation_type\":\"linear\","
                + "\"relation\":\"=\",\"lhs\":{\"type\":\"sum\",\"terms\":[{\"type\":\"product\",\"factors\":["
                + "{\"type\":\"constant\",\"value\":3},{\"type\":\"variable\",\"name\":\"x\"}]},"
                + "{\"type\":\"constant\",\"value\":5}]},\"rhs\":{\"type\":\"constant\",\"value\":11}}", json);
    }

    @Test
    public void testFieldOrder() {
        JsonNode.JsonObject json = serializer.toJson(parse("x >= 2"));
        assertEquals(List.of("id", "raw", "variables", "equation_type", "relation", "lhs", "rhs"),
                json.fields().keysView().toList());
        assertEquals(new JsonNode.JsonString(">="), json.get("relation"));
    }

    @Test
    public void testPiecewiseCarriesBranches() {
        JsonNode.JsonObject json = serializer.toJson(parse("f(x) = { x^2 , x > 0 ; 0 , x <= 0 }"));

        assertEquals(new JsonNode.JsonString("piecewise"), json.get("equation_type"));
        JsonNode.JsonObject lhs = (JsonNode.JsonObject) json.get("lhs");
        assertEquals(new JsonNode.JsonString("function_def"), lhs.get("type"));
        assertEquals(new JsonNode.JsonString("f"), lhs.get("name"));
        assertEquals(new JsonNode.JsonString("x"), lhs.get("variable"));

        JsonNode.JsonArray branches = (JsonNode.JsonArray) json.get("branches");
        assertEquals(2, branches.elements().size());
        JsonNode.JsonObject first = (JsonNode.JsonObject) branches.elements().get(0);
        assertEquals(List.of("condition", "expression"), first.fields().keysView().toList());
        JsonNode.JsonObject condition = (JsonNode.JsonObject) first.get("condition");
        assertEquals(new JsonNode.JsonString("relational"), condition.get("type"));
        assertEquals(new JsonNode.JsonString(">"), condition.get("relation"));

        JsonNode.JsonObject rhs = (JsonNode.JsonObject) json.get("rhs");
        assertEquals(new JsonNode.JsonString("piecewise"), rhs.get("type"));
        assertEquals(branches, rhs.get("branches"));
    }

    @Test
    public void testUnparsedBranchIsAStringConstant() {
        JsonNode.JsonObject json = serializer.toJson(parse("f(x) = { 2x + , x > 0 ; x , x <= 0 }"));

        JsonNode.JsonArray branches = (JsonNode.JsonArray) json.get("branches");
        JsonNode.JsonObject first = (JsonNode.JsonObject) branches.elements().get(0);
        JsonNode.JsonObject expression = (JsonNode.JsonObject) first.get("expression");
        assertEquals(new JsonNode.JsonString("constant"), expression.get("type"));
        assertEquals(new JsonNode.JsonString("2x +"), expression.get("value"));
        JsonNode.JsonObject condition = (JsonNode.JsonObject) first.get("condition");
        assertEquals(new JsonNode.JsonString("x > 0"), condition.get("value"));
    }

    @Test
    public void testNumbers() {
        assertEquals(JsonNode.JsonNumber.of(1000L), EquationSerializer.number(new BigDecimal("1E+3")));
        assertEquals(JsonNode.JsonNumber.of(-7L), EquationSerializer.number(new BigDecimal("-7")));
        assertEquals(JsonNode.JsonNumber.of(new BigDecimal("0.25")), EquationSerializer.number(new BigDecimal("0.25")));
        assertEquals(JsonNode.JsonNumber.of(new BigDecimal("1E+20")), EquationSerializer.number(new BigDecimal("1E+20")));
    }

    @Test
    public void testLargeIntegersAreWrittenExactly() {
        String json = new OutputFormatter(false).format(serializer.toJson(parse("x = 12345678901234567890")));
        assertTrue(json.endsWith("\"rhs\":{\"type\":\"constant\",\"value\":12345678901234567890}}"), json);

        String decimal = new OutputFormatter(false).format(serializer.toJson(parse("x = 0.1234567890123456789012345")));
        assertTrue(decimal.contains("\"value\":0.1234567890123456789012345}"), decimal);
    }

    @Test
    public void testDocument() {
        ParseBatch batch = parser.parseMany(List.of("x = 1", "nonsense", "2x = 4"));
        JsonNode.JsonObject document = serializer.toJson(batch, "input.txt");

        assertEquals(List.of("source_file", "count", "equations"), document.fields().keysView().toList());
        assertEquals(JsonNode.JsonNumber.of(2L), document.get("count"));
        assertEquals(2, ((JsonNode.JsonArray) document.get("equations")).elements().size());

        JsonNode.JsonObject anonymous = serializer.toJson(batch, null);
        assertNull(anonymous.get("source_file"));
        assertEquals(List.of("count", "equations"), anonymous.fields().keysView().toList());
    }

    @ParameterizedTest
    @ValueSource(strings = {"3x + 5 = 11", "x^2 - 4 = 0", "|x - 3| = 7", "2^x = 8", "x/4 = 2.5", "x/3 = 1",
            "log(x, 2) = 3", "sqrt(2x + 1) = 3", "1/(x - 1) = 2", "x + y < 1", "f(x) = 3",
            "f(x) = { 9x + 10 , x >= 0 ; 6x - 14 , x < 0 }", "f(x) = { 2x + , x > 0 ; x , x <= 0 }",
            "x = 12345678901234567890", "x = -98765432109876543210", "x = 0.1234567890123456789012345",
            "x/8 = 9223372036854775807", "0.000000000000000000001x = 1000000000000000000000"})
    public void testDecodingRestoresTheEquation(String line) throws IOException {
        Equation equation = parse(line);
        for (boolean pretty : new boolean[] {true, false}) {
            String text = new OutputFormatter(pretty).format(serializer.toJson(equation));
            assertEquals(equation, decoder.decodeEquation(reader.read(text)));
        }
    }

    @Test
    public void testDecodingDocument() throws IOException {
        ParseBatch batch = parser.parseMany(List.of("x = 1", "y**2 > 4"));
        String text = new OutputFormatter(true).format(serializer.toJson(batch, "eq.txt"));
        assertEquals(batch.equations(), decoder.decodeDocument(reader.read(text)));
    }

    @Test
    public void testDecodingRejectsUnknownNodes() throws IOException {
        JsonNode node = reader.read("{\"type\":\"matrix\"}");
        assertThrows(IllegalArgumentException.class, () -> decoder.decode(node));
        assertThrows(IllegalArgumentException.class, () -> decoder.decode(reader.read("{\"type\":\"variable\"}")));
        assertEquals(new ExpressionNode.Variable("t"), decoder.decode(reader.read("{\"type\":\"variable\",\"name\":\"t\"}")));
    }
}
