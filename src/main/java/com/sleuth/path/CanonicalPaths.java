package com.sleuth.path;

public final class CanonicalPaths {
    public static final String ROOT = "$";

    private CanonicalPaths() {
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static boolean isIdentifier(String key) {
        if (key.isEmpty()) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!isIdentifierChar(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Appends a member access to {@code prefix}, where an empty prefix stands for the root.
     */
    public static String member(String prefix, String key) {
        if (isIdentifier(key)) {
            return prefix.isEmpty() ? key : prefix + "." + key;
        }
        StringBuilder sb = new StringBuilder(prefix.length() + key.length() + 4).append(prefix).append("['");
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '\'' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append("']").toString();
    }

    public static String index(String prefix, int index) {
        return prefix + "[" + index + "]";
    }

    /** Turns an internal prefix into the path reported to callers. */
    public static String finish(String prefix) {
        return prefix.isEmpty() ? ROOT : prefix;
    }
}
