package com.eqtree.output;

import com.eqtree.json.JsonNode;

import java.util.Map;

public class OutputFormatter {
    private final boolean prettyPrint;

    // StringBuilder pool, one per thread
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(4096));

    public OutputFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(JsonNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (prettyPrint) {
            formatPretty(node, 0, sb);
        } else {
            formatCompact(node, sb);
        }

        return sb.toString();
    }

    private void formatPretty(JsonNode node, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (node instanceof JsonNode.JsonObject obj) {
            if (obj.fields().isEmpty()) {
                sb.append("{}");
                return;
            }

            sb.append("{\n");

            boolean first = true;
            for (Map.Entry<String, JsonNode> entry : obj.fields().entrySet()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr)
                  .append("  \"")
                  .append(escapeString(entry.getKey()))
                  .append("\": ");
                formatPretty(entry.getValue(), indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("}");
        } else if (node instanceof JsonNode.JsonArray arr) {
            if (arr.elements().isEmpty()) {
                sb.append("[]");
                return;
            }

            sb.append("[\n");

            boolean first = true;
            for (JsonNode element : arr.elements()) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("  ");
                formatPretty(element, indent + 2, sb);
            }

            sb.append("\n").append(indentStr).append("]");
        } else {
            formatScalar(node, sb);
        }
    }

    private void formatCompact(JsonNode node, StringBuilder sb) {
        if (node instanceof JsonNode.JsonObject obj) {
            sb.append("{");

            boolean first = true;
            for (Map.Entry<String, JsonNode> entry : obj.fields().entrySet()) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"")
                  .append(escapeString(entry.getKey()))
                  .append("\":");
                formatCompact(entry.getValue(), sb);
            }

            sb.append("}");
        } else if (node instanceof JsonNode.JsonArray arr) {
            sb.append("[");

            boolean first = true;
            for (JsonNode element : arr.elements()) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                formatCompact(element, sb);
            }

            sb.append("]");
        } else {
            formatScalar(node, sb);
        }
    }

    private void formatScalar(JsonNode node, StringBuilder sb) {
        if (node instanceof JsonNode.JsonString s) {
            sb.append("\"").append(escapeString(s.value())).append("\"");
        } else if (node instanceof JsonNode.JsonNumber n) {
            sb.append(n.toJsonString());
        } else if (node instanceof JsonNode.JsonBoolean b) {
            sb.append(b.value());
        } else {
            sb.append("null");
        }
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
