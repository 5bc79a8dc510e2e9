package com.sleuth.path;

public class PathParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int NEAR_LENGTH = 12;

    private final String expression;
    private final int position;

    public PathParseException(String message, String expression, int position) {
        super(formatMessage(message, expression, position));
        this.expression = expression;
        this.position = position;
    }

    public String expression() {
        return expression;
    }

    /** Zero-based offset into {@link #expression()} where parsing failed. */
    public int position() {
        return position;
    }

    /** The text at the failure position, empty when parsing failed at the end of the expression. */
    public String near() {
        return near(expression, position);
    }

    private static String near(String expression, int position) {
        if (expression == null || position < 0 || position >= expression.length()) {
            return "";
        }
        return expression.substring(position, Math.min(expression.length(), position + NEAR_LENGTH));
    }

    private static String formatMessage(String message, String expression, int position) {
        StringBuilder sb = new StringBuilder(message)
                .append(" at position ").append(position)
                .append(" in path: ").append(expression);
        String near = near(expression, position);
        if (!near.isEmpty()) {
            sb.append(" (near '").append(near).append("')");
        }
        return sb.toString();
    }
}
