package com.sleuth.path;

import com.sleuth.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// A step that cannot apply to a value contributes nothing for it; a miss is never an error.
public class PathEvaluator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathEvaluator.class);

    private final FilterEvaluator filterEvaluator = new FilterEvaluator(this);

    public MutableList<JsonNode> resolve(JsonNode document, ImmutableList<PathStep> steps) {
        MutableList<JsonNode> frontier = Lists.mutable.with(document);
        for (PathStep step : steps) {
            frontier = frontier.flatCollect(node -> apply(step, node));
            LOGGER.trace("{} left {} value(s)", step, frontier.size());
            if (frontier.isEmpty()) {
                break;
            }
        }
        return frontier;
    }

    private MutableList<JsonNode> apply(PathStep step, JsonNode node) {
        if (step instanceof PathStep.Member member) {
            return selectMember(node, member.name());
        }
        if (step instanceof PathStep.Wildcard) {
            return children(node);
        }
        if (step instanceof PathStep.Index index) {
            return selectIndex(node, index.index());
        }
        if (step instanceof PathStep.Filter filter) {
            return children(node).select(child -> filterEvaluator.matches(child, filter.predicate()));
        }
        throw new IllegalStateException("Unknown path step: " + step);
    }

    private static MutableList<JsonNode> selectMember(JsonNode node, String name) {
        if (node instanceof JsonNode.JsonObject obj) {
            JsonNode value = obj.fields().get(name);
            if (value != null) {
                return Lists.mutable.with(value);
            }
        }
        return Lists.mutable.empty();
    }

    private static MutableList<JsonNode> selectIndex(JsonNode node, int index) {
        if (node instanceof JsonNode.JsonArray arr) {
            MutableList<JsonNode> elements = arr.elements();
            int position = index < 0 ? elements.size() + index : index;
            if (position >= 0 && position < elements.size()) {
                return Lists.mutable.with(elements.get(position));
            }
        }
        return Lists.mutable.empty();
    }

    /** Array elements in order, or object member values in insertion order. */
    private static MutableList<JsonNode> children(JsonNode node) {
        if (node instanceof JsonNode.JsonArray arr) {
            return Lists.mutable.withAll(arr.elements());
        }
        if (node instanceof JsonNode.JsonObject obj) {
            return Lists.mutable.withAll(obj.fields().values());
        }
        return Lists.mutable.empty();
    }
}
