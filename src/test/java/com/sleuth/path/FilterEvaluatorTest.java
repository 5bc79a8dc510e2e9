package com.sleuth.path;

import com.sleuth.json.JsonNode;
import com.sleuth.json.SleuthJsonParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class FilterEvaluatorTest {

    private final PathParser parser = new PathParser();
    private final FilterEvaluator filterEvaluator = new FilterEvaluator(new PathEvaluator());

    private FilterPredicate predicate(String filter) {
        PathStep step = parser.parse(filter).get(0);
        assertTrue(step instanceof PathStep.Filter, "Not a filter: " + filter);
        return ((PathStep.Filter) step).predicate();
    }

    private boolean matches(String candidateJson, String filter) throws IOException {
        JsonNode candidate = new SleuthJsonParser().parse(candidateJson);
        return filterEvaluator.matches(candidate, predicate(filter));
    }

    @Test
    public void testSimpleMemberEquality() throws IOException {
        assertTrue(matches("{\"title\":\"Sword\"}", "[?(@.title == 'Sword')]"));
        assertFalse(matches("{\"title\":\"Shield\"}", "[?(@.title == 'Sword')]"));
    }

    @Test
    public void testAnyOfManyValuesSatisfies() throws IOException {
        String party = "{\"results\":[{\"item\":\"B\"},{\"item\":\"A\"}]}";
        assertTrue(matches(party, "[?(@.results[*].item == 'A')]"));
        assertTrue(matches(party, "[?(@.results[*].item == 'B')]"));
        assertFalse(matches(party, "[?(@.results[*].item == 'C')]"));
    }

    @Test
    public void testEmptyResolutionIsFalse() throws IOException {
        assertFalse(matches("{\"results\":[]}", "[?(@.results[*].item == 'A')]"));
        assertFalse(matches("{}", "[?(@.missing == null)]"));
        assertFalse(matches("42", "[?(@.a == 42)]"));
    }

    @Test
    public void testTypeMustMatch() throws IOException {
        assertFalse(matches("{\"v\":\"1\"}", "[?(@.v == 1)]"));
        assertFalse(matches("{\"v\":true}", "[?(@.v == 1)]"));
        assertTrue(matches("{\"v\":1.0}", "[?(@.v == 1)]"));
    }

    @Test
    public void testCandidateItself() throws IOException {
        assertTrue(matches("\"x\"", "[?(@ == 'x')]"));
        assertFalse(matches("{\"a\":\"x\"}", "[?(@ == 'x')]"));
    }

    @Test
    public void testQuotedKeyInSubpath() throws IOException {
        assertTrue(matches("{\"a b\":{\"c\":2}}", "[?(@['a b'].c == 2)]"));
    }
}
