package com.eqtree.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;

/**
 * Minimal JSON document model. Object fields keep insertion order so that emitted documents
 * follow the field order of the output schema.
 */
public sealed interface JsonNode {
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(orderedMap());
        }

        public JsonObject with(String key, JsonNode value) {
            MutableMap<String, JsonNode> newFields = orderedMap();
            newFields.putAll(fields);
            newFields.put(key, value);
            return new JsonObject(newFields);
        }

        public JsonObject with(String key, String value) {
            return with(key, new JsonString(value));
        }

        public JsonNode get(String key) {
            return fields.get(key);
        }

        static MutableMap<String, JsonNode> orderedMap() {
            return MapAdapter.adapt(new LinkedHashMap<>());
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }

        public JsonArray with(JsonNode element) {
            MutableList<JsonNode> newElements = Lists.mutable.ofAll(elements);
            newElements.add(element);
            return new JsonArray(newElements);
        }
    }

    record JsonString(String value) implements JsonNode {}

    sealed interface JsonNumber extends JsonNode {
        String toJsonString();
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        /** Arbitrary-precision number, written out without exponent notation. */
        record JsonDecimal(BigDecimal value) implements JsonNumber {
            @Override
            public String toJsonString() {
                if (value.signum() == 0) {
                    return "0";
                }
                BigDecimal stripped = value.stripTrailingZeros();
                return stripped.scale() <= 0 ? stripped.toBigIntegerExact().toString() : stripped.toPlainString();
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(BigDecimal value) {
            return new JsonDecimal(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {}
    record JsonNull() implements JsonNode {}
}
