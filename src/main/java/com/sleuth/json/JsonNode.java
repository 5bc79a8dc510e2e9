package com.sleuth.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

public sealed interface JsonNode {
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(newFields());
        }

        public JsonObject with(String key, JsonNode value) {
            MutableMap<String, JsonNode> copy = newFields();
            copy.putAll(fields);
            copy.put(key, value);
            return new JsonObject(copy);
        }

        // Member order is the order keys were first inserted
        static MutableMap<String, JsonNode> newFields() {
            return MapAdapter.adapt(new LinkedHashMap<>());
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray of(JsonNode... elements) {
            return new JsonArray(Lists.mutable.with(elements));
        }
    }

    record JsonString(String value) implements JsonNode {}

    sealed interface JsonNumber extends JsonNode {
        String toJsonString();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Double.toString(value);
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {
        public static final JsonBoolean TRUE = new JsonBoolean(true);
        public static final JsonBoolean FALSE = new JsonBoolean(false);

        public static JsonBoolean of(boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    record JsonNull() implements JsonNode {
        public static final JsonNull INSTANCE = new JsonNull();
    }

    default boolean isContainer() {
        return this instanceof JsonObject || this instanceof JsonArray;
    }
}
