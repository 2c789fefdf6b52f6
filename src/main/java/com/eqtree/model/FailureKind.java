package com.eqtree.model;

public enum FailureKind {
    /** The line is empty after trimming. Not an error, the line is just skipped. */
    BLANK_LINE,
    /** None of the relational operators occurs, or one side of it is empty. */
    RELATION_NOT_FOUND,
    /** Unbalanced parentheses, an unexpected token, an empty operand or ambiguous bars. */
    PARSE_ERROR
}
