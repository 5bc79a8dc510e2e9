package com.sleuth;

import com.sleuth.json.JsonNode;
import com.sleuth.path.JsonPath;
import com.sleuth.path.PathEnumerator;
import com.sleuth.path.PathParseException;
import com.sleuth.path.PathValue;
import org.eclipse.collections.api.list.MutableList;

/**
 * Entry points for querying decoded JSON documents.
 * <p>
 * All three operations are pure: they read the document and never modify it, so they may run concurrently
 * against the same document as long as nobody mutates it meanwhile.
 */
public final class JsonPathSleuth {
    private static final PathEnumerator ENUMERATOR = new PathEnumerator();

    private JsonPathSleuth() {
    }

    /**
     * Values matched by {@code expression}, in document order. A path that reaches nothing yields an empty list.
     *
     * @throws PathParseException if the expression is malformed
     */
    public static MutableList<JsonNode> resolveJsonPath(JsonNode document, String expression) {
        return JsonPath.compile(expression).resolve(document);
    }

    /** Canonical paths of every node structurally equal to {@code target}. */
    public static MutableList<String> findJsonPathsByValue(JsonNode document, JsonNode target) {
        return ENUMERATOR.findPathsByValue(document, target);
    }

    /** Canonical path and value of every scalar in the document. */
    public static MutableList<PathValue> extractJsonPathsAndValues(JsonNode document) {
        return ENUMERATOR.extractPathsAndValues(document);
    }
}
