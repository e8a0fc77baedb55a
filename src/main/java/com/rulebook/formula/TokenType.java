package com.rulebook.formula;

/**
 * Token types for formula parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    FIELD_REF,
    FUNCTION_NAME,
    STRING,
    INTEGER,
    BOOLEAN,

    // Keywords
    AND,
    OR,
    NOT,
    IF,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,

    // Operators
    AMPERSAND,
    EQ,
    NE,
    LT,
    LTE,
    GT,
    GTE,
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Special
    EOF
}
