package com.sleuth.path;

import com.sleuth.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;

public sealed interface FilterPredicate {
    /**
     * Holds when at least one value reached from the candidate through {@code subpath} is equivalent to
     * {@code literal}. An empty subpath refers to the candidate itself.
     */
    record Equals(ImmutableList<PathStep> subpath, JsonNode literal) implements FilterPredicate {}
}
