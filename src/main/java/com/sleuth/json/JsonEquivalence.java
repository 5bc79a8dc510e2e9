package com.sleuth.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;

import java.math.BigDecimal;

// Numbers compare by exact value, so 1 and 1.0 are equal. Object member order is ignored.
public final class JsonEquivalence {

    private JsonEquivalence() {
    }

    public static boolean equivalent(JsonNode left, JsonNode right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof JsonNode.JsonNumber a && right instanceof JsonNode.JsonNumber b) {
            return numbersEqual(a, b);
        }
        if (left instanceof JsonNode.JsonArray a && right instanceof JsonNode.JsonArray b) {
            return arraysEqual(a.elements(), b.elements());
        }
        if (left instanceof JsonNode.JsonObject a && right instanceof JsonNode.JsonObject b) {
            return objectsEqual(a.fields(), b.fields());
        }
        // Strings, booleans and null are plain records
        return left.equals(right);
    }

    private static boolean numbersEqual(JsonNode.JsonNumber a, JsonNode.JsonNumber b) {
        if (a instanceof JsonNode.JsonNumber.JsonLong x && b instanceof JsonNode.JsonNumber.JsonLong y) {
            return x.value() == y.value();
        }
        if (a instanceof JsonNode.JsonNumber.JsonDouble x && b instanceof JsonNode.JsonNumber.JsonDouble y) {
            return x.value() == y.value();
        }
        BigDecimal x = exact(a);
        BigDecimal y = exact(b);
        return x != null && y != null && x.compareTo(y) == 0;
    }

    private static BigDecimal exact(JsonNode.JsonNumber number) {
        if (number instanceof JsonNode.JsonNumber.JsonLong l) {
            return BigDecimal.valueOf(l.value());
        }
        double d = ((JsonNode.JsonNumber.JsonDouble) number).value();
        return Double.isFinite(d) ? new BigDecimal(d) : null;
    }

    private static boolean arraysEqual(MutableList<JsonNode> a, MutableList<JsonNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!equivalent(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean objectsEqual(MutableMap<String, JsonNode> a, MutableMap<String, JsonNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        return a.keyValuesView().allSatisfy(entry -> {
            JsonNode other = b.get(entry.getOne());
            return other != null && equivalent(entry.getTwo(), other);
        });
    }
}
