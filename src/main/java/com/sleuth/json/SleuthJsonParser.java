package com.sleuth.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class SleuthJsonParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(SleuthJsonParser.class);

    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(InputStream input) throws IOException {
        return parse(input, true);
    }

    // Pass closeInput=false for streams owned by someone else, such as System.in
    public JsonNode parse(InputStream input, boolean closeInput) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            parser.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, closeInput);
            return parseDocument(parser);
        }
    }

    public JsonNode parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseDocument(parser);
        }
    }

    private JsonNode parseDocument(JsonParser parser) throws IOException {
        JsonToken first = parser.nextToken();
        if (first == null) {
            throw new IOException("Empty JSON document");
        }
        JsonNode root = parseValue(parser, first);
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new IOException("Unexpected trailing content after JSON document: " + trailing);
        }
        return root;
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> parseInteger(parser);
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE, VALUE_FALSE -> JsonNode.JsonBoolean.of(token == JsonToken.VALUE_TRUE);
            case VALUE_NULL -> JsonNode.JsonNull.INSTANCE;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode parseInteger(JsonParser parser) throws IOException {
        if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
            LOGGER.debug("Integer {} does not fit in a long; keeping it as a double", parser.getText());
            return JsonNode.JsonNumber.of(parser.getDoubleValue());
        }
        return JsonNode.JsonNumber.of(parser.getLongValue());
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        MutableMap<String, JsonNode> fields = JsonNode.JsonObject.newFields();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new IOException("Expected field name but found " + token);
            }
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return new JsonNode.JsonObject(fields);
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        MutableList<JsonNode> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token == null) {
                throw new IOException("Unterminated JSON array");
            }
            elements.add(parseValue(parser, token));
        }

        return new JsonNode.JsonArray(elements);
    }
}
