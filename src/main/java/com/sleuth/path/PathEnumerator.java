package com.sleuth.path;

import com.sleuth.json.JsonEquivalence;
import com.sleuth.json.JsonNode;
import org.eclipse.collections.api.block.procedure.Procedure2;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PathEnumerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathEnumerator.class);

    /**
     * Paths of every node equivalent to {@code target}, containers and the root included. Descends into a
     * matching container, so nested matches are reported too.
     */
    public MutableList<String> findPathsByValue(JsonNode document, JsonNode target) {
        MutableList<String> paths = Lists.mutable.empty();
        walk(document, "", (path, node) -> {
            if (JsonEquivalence.equivalent(node, target)) {
                paths.add(CanonicalPaths.finish(path));
            }
        });
        LOGGER.debug("Found {} path(s) holding {}", paths.size(), target);
        return paths;
    }

    /**
     * A (path, value) pair for every scalar in the document. Containers are not reported themselves, so empty
     * objects and arrays contribute nothing; a scalar document yields one pair for the root path.
     */
    public MutableList<PathValue> extractPathsAndValues(JsonNode document) {
        MutableList<PathValue> pairs = Lists.mutable.empty();
        walk(document, "", (path, node) -> {
            if (!node.isContainer()) {
                pairs.add(new PathValue(CanonicalPaths.finish(path), node));
            }
        });
        LOGGER.debug("Extracted {} leaf value(s)", pairs.size());
        return pairs;
    }

    private static void walk(JsonNode node, String path, Procedure2<String, JsonNode> visitor) {
        visitor.value(path, node);
        if (node instanceof JsonNode.JsonObject obj) {
            obj.fields().forEachKeyValue((key, child) -> walk(child, CanonicalPaths.member(path, key), visitor));
        } else if (node instanceof JsonNode.JsonArray arr) {
            arr.elements().forEachWithIndex((child, i) -> walk(child, CanonicalPaths.index(path, i), visitor));
        }
    }
}
