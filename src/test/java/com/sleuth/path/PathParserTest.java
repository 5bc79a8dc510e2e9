package com.sleuth.path;

import com.sleuth.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class PathParserTest {

    private final PathParser parser = new PathParser();

    private static PathStep member(String name) {
        return new PathStep.Member(name);
    }

    private static PathStep index(int i) {
        return new PathStep.Index(i);
    }

    private static PathStep wildcard() {
        return new PathStep.Wildcard();
    }

    private static PathStep equalsFilter(JsonNode literal, PathStep... subpath) {
        return new PathStep.Filter(new FilterPredicate.Equals(Lists.immutable.with(subpath), literal));
    }

    // ============================================================
    // Accepted syntax
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {"a.b.c", "$.a.b.c", ".a.b.c", "$['a']['b']['c']", "a['b'].c",
            "[\"a\"].b[\"c\"]", "  $.a.b.c  ", "$.['a'].b.c"})
    public void testEquivalentSpellings(String expression) {
        assertEquals(List.of(member("a"), member("b"), member("c")), parser.parse(expression));
    }

    @Test
    public void testRootOnly() {
        assertTrue(parser.parse("$").isEmpty());
        assertTrue(parser.parse(" $ ").isEmpty());
    }

    @Test
    public void testWildcards() {
        assertEquals(List.of(member("store"), member("book"), wildcard(), member("title")),
                parser.parse("$.store.book[*].title"));
        assertEquals(List.of(member("store"), wildcard()), parser.parse("store.*"));
        assertEquals(List.of(wildcard(), wildcard()), parser.parse("*[*]"));
        assertEquals(List.of(wildcard()), parser.parse("$[ * ]"));
    }

    @Test
    public void testIndices() {
        assertEquals(List.of(member("d"), index(0), member("e")), parser.parse("d[0].e"));
        assertEquals(List.of(index(12), index(-1)), parser.parse("[12][-1]"));
    }

    @Test
    public void testQuotedKeys() {
        assertEquals(List.of(member("a b"), member("c-d_e"), member("k")), parser.parse("['a b']['c-d_e'].k"));
        assertEquals(List.of(member("it's")), parser.parse("['it\\'s']"));
        assertEquals(List.of(member("say \"hi\"")), parser.parse("[\"say \\\"hi\\\"\"]"));
        assertEquals(List.of(member("back\\slash")), parser.parse("['back\\\\slash']"));
        assertEquals(List.of(member("tab\there")), parser.parse("['tab\\there']"));
        assertEquals(List.of(member("é")), parser.parse("['\\u00e9']"));
        assertEquals(List.of(member("é")), parser.parse("['\\u00E9']"));
        assertEquals(List.of(member("a]b.c")), parser.parse("['a]b.c']"));
        assertEquals(List.of(member("")), parser.parse("['']"));
    }

    @Test
    public void testFilterWithNestedWildcard() {
        ImmutableList<PathStep> steps = parser.parse("parties[?(@.results[*].item=='A')].name");

        assertEquals(List.of(
                member("parties"),
                equalsFilter(new JsonNode.JsonString("A"), member("results"), wildcard(), member("item")),
                member("name")), steps);
    }

    @Test
    public void testFilterWithNestedFilter() {
        ImmutableList<PathStep> steps = parser.parse("a[?(@.b[?(@.c == 1)].d == 'x')]");

        PathStep inner = equalsFilter(JsonNode.JsonNumber.of(1L), member("c"));
        assertEquals(List.of(
                member("a"),
                equalsFilter(new JsonNode.JsonString("x"), member("b"), inner, member("d"))), steps);
    }

    @Test
    public void testFilterOnCandidateItself() {
        assertEquals(List.of(equalsFilter(JsonNode.JsonNumber.of(2L))), parser.parse("[?(@ == 2)]"));
        assertEquals(List.of(equalsFilter(JsonNode.JsonNumber.of(2L))), parser.parse("[ ?( @==2 ) ]"));
    }

    static Stream<Arguments> filterLiterals() {
        return Stream.of(
                Arguments.of("'Sword'", new JsonNode.JsonString("Sword")),
                Arguments.of("\"Sword\"", new JsonNode.JsonString("Sword")),
                Arguments.of("'a == b'", new JsonNode.JsonString("a == b")),
                Arguments.of("42", JsonNode.JsonNumber.of(42L)),
                Arguments.of("-7", JsonNode.JsonNumber.of(-7L)),
                Arguments.of("19.95", JsonNode.JsonNumber.of(19.95)),
                Arguments.of("-1.5e2", JsonNode.JsonNumber.of(-150.0)),
                Arguments.of("1E+3", JsonNode.JsonNumber.of(1000.0)),
                Arguments.of("99999999999999999999", JsonNode.JsonNumber.of(1.0E20)),
                Arguments.of("true", JsonNode.JsonBoolean.TRUE),
                Arguments.of("false", JsonNode.JsonBoolean.FALSE),
                Arguments.of("null", JsonNode.JsonNull.INSTANCE));
    }

    @ParameterizedTest
    @MethodSource("filterLiterals")
    public void testFilterLiterals(String literal, JsonNode expected) {
        assertEquals(List.of(equalsFilter(expected, member("v"))), parser.parse("[?(@.v == " + literal + ")]"));
    }

    @Test
    public void testParsedPathIsImmutable() {
        ImmutableList<PathStep> steps = parser.parse("a.b");
        assertThrows(UnsupportedOperationException.class, () -> steps.castToList().add(member("c")));
    }

    // ============================================================
    // Errors
    // ============================================================

    static Stream<Arguments> malformedExpressions() {
        return Stream.of(
                Arguments.of("", 0, "Empty path expression"),
                Arguments.of("   ", 0, "Empty path expression"),
                Arguments.of("$.", 2, "Expected member name"),
                Arguments.of("a.", 2, "Expected member name after '.'"),
                Arguments.of("a..b", 2, "Recursive descent is not supported"),
                Arguments.of("a b", 1, "Unexpected character"),
                Arguments.of("$a.b", 1, "Unexpected character"),
                Arguments.of("a[1", 1, "Unterminated bracket"),
                Arguments.of("a[", 1, "Unterminated bracket"),
                Arguments.of("a['b", 2, "Unterminated quoted string"),
                Arguments.of("a['b']x", 6, "Unexpected character"),
                Arguments.of("a[x]", 2, "Unsupported bracket content"),
                Arguments.of("a[1:2]", 3, "Slices and unions are not supported"),
                Arguments.of("a[1,2]", 3, "Slices and unions are not supported"),
                Arguments.of("a[-]", 3, "Expected digits in index"),
                Arguments.of("a[99999999999]", 2, "Index out of range"),
                Arguments.of("a['b' x]", 6, "Expected ']'"),
                Arguments.of("a[?(@.b != 1)]", 8, "Unsupported filter operator '!='"),
                Arguments.of("a[?(@.b < 1)]", 8, "Unsupported filter operator '<'"),
                Arguments.of("a[?(@.b = 1)]", 8, "Unsupported filter operator '='"),
                Arguments.of("a[?(@.b)]", 7, "Expected '==' in filter"),
                Arguments.of("a[?(@.b == maybe)]", 11, "Unsupported filter literal"),
                Arguments.of("a[?(@.b == 'x']", 14, "Expected ')'"),
                Arguments.of("a[?(b == 1)]", 4, "Expected '@'"),
                Arguments.of("a[?@.b == 1]", 3, "Expected '('"),
                Arguments.of("['\\q']", 2, "Invalid escape sequence"),
                Arguments.of("['\\u12']", 2, "Invalid unicode escape"),
                Arguments.of("['\\u+041']", 2, "Invalid unicode escape"),
                Arguments.of("['\\u-041']", 2, "Invalid unicode escape"),
                Arguments.of("['\\u00g9']", 2, "Invalid unicode escape"));
    }

    @ParameterizedTest
    @MethodSource("malformedExpressions")
    public void testMalformedExpressions(String expression, int position, String message) {
        PathParseException e = assertThrows(PathParseException.class, () -> parser.parse(expression));

        assertEquals(expression, e.expression());
        assertEquals(position, e.position());
        assertTrue(e.getMessage().startsWith(message + " at position " + position),
                "Unexpected message: " + e.getMessage());
    }

    @Test
    public void testExceptionReportsNearbyText() {
        PathParseException e = assertThrows(PathParseException.class, () -> parser.parse("a[?(@.b != 1)]"));

        assertEquals("!= 1)]", e.near());
        assertTrue(e.getMessage().endsWith("in path: a[?(@.b != 1)] (near '!= 1)]')"), e.getMessage());
    }

    @Test
    public void testNullExpressionIsRejected() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }
}
