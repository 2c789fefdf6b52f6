package com.eqtree.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;

/**
 * Streams a JSON document into the {@link JsonNode} model.
 */
public class JsonReader {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readValue(parser, parser.nextToken());
        }
    }

    public JsonNode read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readValue(parser, parser.nextToken());
        }
    }

    private JsonNode readValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? JsonNode.JsonNumber.of(new BigDecimal(parser.getBigIntegerValue()))
                    : JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDecimalValue());
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonObject readObject(JsonParser parser) throws IOException {
        MutableMap<String, JsonNode> fields = JsonNode.JsonObject.orderedMap();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, readValue(parser, parser.nextToken()));
        }

        return new JsonNode.JsonObject(fields);
    }

    private JsonNode.JsonArray readArray(JsonParser parser) throws IOException {
        MutableList<JsonNode> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }

        return new JsonNode.JsonArray(elements);
    }
}
