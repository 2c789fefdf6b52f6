package com.eqtree.parse;

/**
 * Malformed expression text: unbalanced parentheses, an unexpected token, an empty operand or
 * absolute-value bars that cannot be paired unambiguously.
 */
public class ExpressionParseException extends IllegalArgumentException {
    private final int position;

    public ExpressionParseException(String message) {
        this(message, -1);
    }

    public ExpressionParseException(String message, int position) {
        super(position < 0 ? message : message + " at position " + position);
        this.position = position;
    }

    /** Zero-based offset into the normalized text, or -1 when unknown. */
    public int getPosition() {
        return position;
    }
}
