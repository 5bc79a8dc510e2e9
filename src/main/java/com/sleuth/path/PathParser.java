package com.sleuth.path;

import com.sleuth.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses path expressions into step lists.
 * <p>
 * Accepted syntax:
 * <ul>
 *     <li>an optional leading {@code $} or {@code $.}</li>
 *     <li>{@code name} or {@code .name} for identifier-like member names (letters, digits, underscore)</li>
 *     <li>{@code ['name']} or {@code ["name"]} for any member name</li>
 *     <li>{@code [*]} or {@code .*} for every element or member value</li>
 *     <li>{@code [n]} for an array index, negative counting from the end</li>
 *     <li>{@code [?(@<subpath> == literal)]} for equality filters, where the subpath may itself contain any of
 *     the above including further wildcards and filters</li>
 * </ul>
 * The parser never looks at a document. Instances are stateless and may be shared.
 */
public class PathParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathParser.class);

    public ImmutableList<PathStep> parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        Cursor cursor = new Cursor(expression);
        if (cursor.atEnd()) {
            throw new PathParseException("Empty path expression", expression, 0);
        }

        MutableList<PathStep> steps = Lists.mutable.empty();
        if (cursor.peek() == '$') {
            cursor.advance();
            if (!cursor.atEnd() && cursor.peek() == '.') {
                cursor.advance();
                steps.add(parseLeadingStep(cursor));
            }
        } else if (cursor.peek() != '.') {
            steps.add(parseLeadingStep(cursor));
        }
        parseSegments(cursor, steps, false);

        ImmutableList<PathStep> parsed = steps.toImmutable();
        LOGGER.debug("Parsed path expression {} into {}", expression, parsed);
        return parsed;
    }

    /**
     * The first step of a path written without a leading dot, as in {@code a.b} or {@code $.['a b']}.
     */
    private PathStep parseLeadingStep(Cursor cursor) {
        if (cursor.atEnd()) {
            throw cursor.error("Expected member name");
        }
        char c = cursor.peek();
        if (c == '[') {
            return parseBracket(cursor);
        }
        if (c == '*') {
            cursor.advance();
            return new PathStep.Wildcard();
        }
        return new PathStep.Member(parseIdentifier(cursor));
    }

    /**
     * Parses dot and bracket segments until the end of input. Inside a filter, stops at the first character that
     * cannot start a segment.
     */
    private void parseSegments(Cursor cursor, MutableList<PathStep> steps, boolean insideFilter) {
        while (!cursor.atEnd()) {
            char c = cursor.peek();
            if (c == '.') {
                steps.add(parseDot(cursor));
            } else if (c == '[') {
                steps.add(parseBracket(cursor));
            } else if (insideFilter) {
                return;
            } else {
                throw cursor.error("Unexpected character");
            }
        }
    }

    private PathStep parseDot(Cursor cursor) {
        cursor.advance();
        if (cursor.atEnd()) {
            throw cursor.error("Expected member name after '.'");
        }
        char c = cursor.peek();
        if (c == '*') {
            cursor.advance();
            return new PathStep.Wildcard();
        }
        if (c == '.') {
            throw cursor.error("Recursive descent is not supported");
        }
        return new PathStep.Member(parseIdentifier(cursor));
    }

    private String parseIdentifier(Cursor cursor) {
        int start = cursor.pos;
        while (!cursor.atEnd() && CanonicalPaths.isIdentifierChar(cursor.peek())) {
            cursor.advance();
        }
        if (cursor.pos == start) {
            throw cursor.error("Expected member name");
        }
        return cursor.text.substring(start, cursor.pos);
    }

    private PathStep parseBracket(Cursor cursor) {
        int open = cursor.pos;
        cursor.advance();
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            throw new PathParseException("Unterminated bracket", cursor.text, open);
        }

        char c = cursor.peek();
        PathStep step;
        if (c == '\'' || c == '"') {
            step = new PathStep.Member(parseQuoted(cursor));
        } else if (c == '*') {
            cursor.advance();
            step = new PathStep.Wildcard();
        } else if (c == '?') {
            step = parseFilter(cursor);
        } else if (c == '-' || isDigit(c)) {
            step = new PathStep.Index(parseIndex(cursor));
        } else {
            throw cursor.error("Unsupported bracket content");
        }

        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            throw new PathParseException("Unterminated bracket", cursor.text, open);
        }
        if (cursor.peek() != ']') {
            throw cursor.error("Expected ']'");
        }
        cursor.advance();
        return step;
    }

    private int parseIndex(Cursor cursor) {
        int start = cursor.pos;
        if (cursor.peek() == '-') {
            cursor.advance();
        }
        int digits = cursor.pos;
        while (!cursor.atEnd() && isDigit(cursor.peek())) {
            cursor.advance();
        }
        if (cursor.pos == digits) {
            throw cursor.error("Expected digits in index");
        }
        if (!cursor.atEnd() && (cursor.peek() == ':' || cursor.peek() == ',')) {
            throw cursor.error("Slices and unions are not supported");
        }
        try {
            return Integer.parseInt(cursor.text.substring(start, cursor.pos));
        } catch (NumberFormatException e) {
            throw new PathParseException("Index out of range", cursor.text, start);
        }
    }

    private PathStep.Filter parseFilter(Cursor cursor) {
        cursor.advance();
        cursor.skipWhitespace();
        cursor.expect('(');
        cursor.skipWhitespace();
        cursor.expect('@');

        MutableList<PathStep> subpath = Lists.mutable.empty();
        parseSegments(cursor, subpath, true);

        cursor.skipWhitespace();
        int operatorStart = cursor.pos;
        while (!cursor.atEnd() && "=!<>~".indexOf(cursor.peek()) >= 0) {
            cursor.advance();
        }
        String operator = cursor.text.substring(operatorStart, cursor.pos);
        if (operator.isEmpty()) {
            throw cursor.error("Expected '==' in filter");
        }
        if (!operator.equals("==")) {
            throw new PathParseException("Unsupported filter operator '" + operator + "'", cursor.text, operatorStart);
        }

        cursor.skipWhitespace();
        JsonNode literal = parseLiteral(cursor);
        cursor.skipWhitespace();
        cursor.expect(')');
        return new PathStep.Filter(new FilterPredicate.Equals(subpath.toImmutable(), literal));
    }

    private JsonNode parseLiteral(Cursor cursor) {
        if (cursor.atEnd()) {
            throw cursor.error("Expected literal in filter");
        }
        char c = cursor.peek();
        if (c == '\'' || c == '"') {
            return new JsonNode.JsonString(parseQuoted(cursor));
        }
        if (c == '-' || isDigit(c)) {
            return parseNumber(cursor);
        }

        int start = cursor.pos;
        while (!cursor.atEnd() && Character.isLetter(cursor.peek())) {
            cursor.advance();
        }
        String word = cursor.text.substring(start, cursor.pos);
        return switch (word) {
            case "true" -> JsonNode.JsonBoolean.TRUE;
            case "false" -> JsonNode.JsonBoolean.FALSE;
            case "null" -> JsonNode.JsonNull.INSTANCE;
            default -> throw new PathParseException("Unsupported filter literal", cursor.text, start);
        };
    }

    private JsonNode parseNumber(Cursor cursor) {
        int start = cursor.pos;
        boolean fractional = false;
        if (cursor.peek() == '-') {
            cursor.advance();
        }
        while (!cursor.atEnd()) {
            char c = cursor.peek();
            if (c == '.' || c == 'e' || c == 'E') {
                fractional = true;
            } else if (!isDigit(c) && !((c == '+' || c == '-') && isExponentMarker(cursor.text.charAt(cursor.pos - 1)))) {
                break;
            }
            cursor.advance();
        }

        String text = cursor.text.substring(start, cursor.pos);
        try {
            if (!fractional) {
                try {
                    return JsonNode.JsonNumber.of(Long.parseLong(text));
                } catch (NumberFormatException tooLarge) {
                    LOGGER.debug("Filter literal {} does not fit in a long; keeping it as a double", text);
                }
            }
            return JsonNode.JsonNumber.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new PathParseException("Malformed number literal", cursor.text, start);
        }
    }

    private String parseQuoted(Cursor cursor) {
        int open = cursor.pos;
        char quote = cursor.peek();
        cursor.advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (cursor.atEnd()) {
                throw new PathParseException("Unterminated quoted string", cursor.text, open);
            }
            char c = cursor.peek();
            cursor.advance();
            if (c == quote) {
                return sb.toString();
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (cursor.atEnd()) {
                throw new PathParseException("Unterminated quoted string", cursor.text, open);
            }
            int escape = cursor.pos - 1;
            char e = cursor.peek();
            cursor.advance();
            switch (e) {
                case '\'', '"', '\\', '/' -> sb.append(e);
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'u' -> sb.append(parseUnicodeEscape(cursor, escape));
                default -> throw new PathParseException("Invalid escape sequence", cursor.text, escape);
            }
        }
    }

    private char parseUnicodeEscape(Cursor cursor, int escape) {
        if (cursor.pos + 4 > cursor.end) {
            throw new PathParseException("Invalid unicode escape", cursor.text, escape);
        }
        int decoded = 0;
        for (int i = 0; i < 4; i++) {
            char c = cursor.peek();
            if (!isHexDigit(c)) {
                throw new PathParseException("Invalid unicode escape", cursor.text, escape);
            }
            decoded = (decoded << 4) | Character.digit(c, 16);
            cursor.advance();
        }
        return (char) decoded;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // ASCII only; Character.digit also accepts fullwidth digits
    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isExponentMarker(char c) {
        return c == 'e' || c == 'E';
    }

    /**
     * Read position over one expression. Leading and trailing whitespace lie outside {@code [pos, end)} from the
     * start, so error positions still refer to the caller's text.
     */
    private static final class Cursor {
        private final String text;
        private final int end;
        private int pos;

        Cursor(String text) {
            this.text = text;
            int start = 0;
            int stop = text.length();
            while (start < stop && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            while (stop > start && Character.isWhitespace(text.charAt(stop - 1))) {
                stop--;
            }
            this.pos = start;
            this.end = stop;
        }

        boolean atEnd() {
            return pos >= end;
        }

        char peek() {
            return text.charAt(pos);
        }

        void advance() {
            pos++;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        void expect(char expected) {
            if (atEnd() || peek() != expected) {
                throw error("Expected '" + expected + "'");
            }
            pos++;
        }

        PathParseException error(String message) {
            return new PathParseException(message, text, pos);
        }
    }
}
