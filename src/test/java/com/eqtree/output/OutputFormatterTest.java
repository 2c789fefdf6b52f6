package com.eqtree.output;

import com.eqtree.json.JsonNode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class OutputFormatterTest {
    private final JsonNode sample = JsonNode.JsonObject.empty()
            .with("a", JsonNode.JsonNumber.of(1L))
            .with("b", JsonNode.JsonArray.empty()
                    .with(new JsonNode.JsonString("x"))
                    .with(new JsonNode.JsonBoolean(true)))
            .with("c", JsonNode.JsonObject.empty())
            .with("d", new JsonNode.JsonNull());

    @Test
    public void testPrettyPrint() {
        String expected = "{\n"
                + "  \"a\": 1,\n"
                + "  \"b\": [\n"
                + "    \"x\",\n"
                + "    true\n"
                + "  ],\n"
                + "  \"c\": {},\n"
                + "  \"d\": null\n"
                + "}";
        assertEquals(expected, new OutputFormatter(true).format(sample));
    }

    @Test
    public void testCompact() {
        assertEquals("{\"a\":1,\"b\":[\"x\",true],\"c\":{},\"d\":null}", new OutputFormatter(false).format(sample));
        assertEquals("[]", new OutputFormatter(true).format(JsonNode.JsonArray.empty()));
    }

    @Test
    public void testNumbers() {
        OutputFormatter formatter = new OutputFormatter(false);
        assertEquals("0.25", formatter.format(JsonNode.JsonNumber.of(new BigDecimal("0.25"))));
        assertEquals("3", formatter.format(JsonNode.JsonNumber.of(new BigDecimal("3.0"))));
        assertEquals("100000000000000000000", formatter.format(JsonNode.JsonNumber.of(new BigDecimal("1E+20"))));
        assertEquals("-0.000123", formatter.format(JsonNode.JsonNumber.of(new BigDecimal("-1.23E-4"))));
        assertEquals("0", formatter.format(JsonNode.JsonNumber.of(new BigDecimal("0.000"))));
        assertEquals("-12", formatter.format(JsonNode.JsonNumber.of(-12L)));
    }

    @Test
    public void testEscaping() {
        JsonNode node = new JsonNode.JsonString("say \"hi\"\\\n\t\u0001");
        assertEquals("\"say \\\"hi\\\"\\\\\\n\\t\\u0001\"", new OutputFormatter(false).format(node));
        assertEquals("\"x ≥ 3\"", new OutputFormatter(false).format(new JsonNode.JsonString("x ≥ 3")));
    }
}
