package com.rulebook.formula;

/**
 * Represents a token in a formula.
 *
 * @param type     Token type
 * @param text     Original text, or the enclosed name for field references
 * @param literal  Parsed literal value (for strings, integers, booleans)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    /**
     * Whether a token of this type ends an operand, so that a following
     * {@code -} is a binary minus rather than the sign of a literal.
     */
    public boolean endsOperand() {
        return switch (type) {
            case IDENT, FIELD_REF, STRING, INTEGER, BOOLEAN, RPAREN -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
