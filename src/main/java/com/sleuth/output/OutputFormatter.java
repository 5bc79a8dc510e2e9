package com.sleuth.output;

import com.sleuth.json.JsonNode;
import com.sleuth.path.PathValue;
import org.eclipse.collections.api.tuple.Pair;

import java.util.List;

public class OutputFormatter {
    private static final String INDENT = "  ";

    private final boolean prettyPrint;
    private final boolean sortKeys;

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(JsonNode node) {
        StringBuilder sb = new StringBuilder(64);
        write(node, 0, sb);
        return sb.toString();
    }

    /** One line per pair: the canonical path, a tab, then the value as compact JSON. */
    public String format(PathValue pathValue) {
        StringBuilder sb = new StringBuilder(pathValue.path()).append('\t');
        new OutputFormatter(false, sortKeys).write(pathValue.value(), 0, sb);
        return sb.toString();
    }

    private void write(JsonNode node, int depth, StringBuilder sb) {
        if (node instanceof JsonNode.JsonObject obj) {
            writeObject(obj, depth, sb);
        } else if (node instanceof JsonNode.JsonArray arr) {
            writeArray(arr, depth, sb);
        } else if (node instanceof JsonNode.JsonString s) {
            writeString(s.value(), sb);
        } else if (node instanceof JsonNode.JsonNumber n) {
            sb.append(n.toJsonString());
        } else if (node instanceof JsonNode.JsonBoolean b) {
            sb.append(b.value());
        } else {
            sb.append("null");
        }
    }

    private void writeObject(JsonNode.JsonObject obj, int depth, StringBuilder sb) {
        if (obj.fields().isEmpty()) {
            sb.append("{}");
            return;
        }
        List<Pair<String, JsonNode>> entries = sortKeys
                ? obj.fields().keyValuesView().toSortedListBy(Pair::getOne)
                : obj.fields().keyValuesView().toList();

        sb.append('{');
        boolean first = true;
        for (Pair<String, JsonNode> entry : entries) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(depth + 1, sb);
            writeString(entry.getOne(), sb);
            sb.append(prettyPrint ? ": " : ":");
            write(entry.getTwo(), depth + 1, sb);
        }
        newline(depth, sb);
        sb.append('}');
    }

    private void writeArray(JsonNode.JsonArray arr, int depth, StringBuilder sb) {
        if (arr.elements().isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append('[');
        boolean first = true;
        for (JsonNode element : arr.elements()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(depth + 1, sb);
            write(element, depth + 1, sb);
        }
        newline(depth, sb);
        sb.append(']');
    }

    private void newline(int depth, StringBuilder sb) {
        if (prettyPrint) {
            sb.append('\n').append(INDENT.repeat(depth));
        }
    }

    private static void writeString(String s, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
