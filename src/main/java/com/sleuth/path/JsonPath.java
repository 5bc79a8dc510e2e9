package com.sleuth.path;

import com.sleuth.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

/**
 * A parsed path expression that can be resolved against any number of documents. Instances are immutable and
 * safe to share between threads.
 */
public record JsonPath(String expression, ImmutableList<PathStep> steps) {
    private static final PathParser PARSER = new PathParser();
    private static final PathEvaluator EVALUATOR = new PathEvaluator();

    /**
     * @throws PathParseException if {@code expression} is not a valid path
     */
    public static JsonPath compile(String expression) {
        return new JsonPath(expression, PARSER.parse(expression));
    }

    public MutableList<JsonNode> resolve(JsonNode document) {
        return EVALUATOR.resolve(document, steps);
    }

    @Override
    public String toString() {
        return expression;
    }
}
