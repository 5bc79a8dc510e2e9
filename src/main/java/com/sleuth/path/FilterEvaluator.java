package com.sleuth.path;

import com.sleuth.json.JsonEquivalence;
import com.sleuth.json.JsonNode;

public class FilterEvaluator {
    private final PathEvaluator pathEvaluator;

    public FilterEvaluator(PathEvaluator pathEvaluator) {
        this.pathEvaluator = pathEvaluator;
    }

    public boolean matches(JsonNode candidate, FilterPredicate predicate) {
        if (predicate instanceof FilterPredicate.Equals equals) {
            return pathEvaluator.resolve(candidate, equals.subpath())
                    .anySatisfy(value -> JsonEquivalence.equivalent(value, equals.literal()));
        }
        throw new IllegalStateException("Unknown filter predicate: " + predicate);
    }
}
