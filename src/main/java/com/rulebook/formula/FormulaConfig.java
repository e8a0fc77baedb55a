package com.rulebook.formula;

import java.util.Map;

/**
 * Keywords and operator symbols of the formula language.
 */
public final class FormulaConfig {

    private FormulaConfig() {
    }

    /**
     * Keywords mapped to token types. Matched case-insensitively.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "IF", TokenType.IF,
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "TRUE", true,
            "FALSE", false
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char COMMA = ',';
        public static final char AMPERSAND = '&';
        public static final char EQUALS = '=';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }

    /**
     * Marker that rulebook documents put in front of every formula.
     */
    public static final char FORMULA_MARKER = '=';
}
