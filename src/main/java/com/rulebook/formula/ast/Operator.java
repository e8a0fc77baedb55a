package com.rulebook.formula.ast;

/**
 * Operators of the formula language.
 */
public enum Operator {
    // Logical
    AND("AND", false),
    OR("OR", false),
    NOT("NOT", true),

    // Comparison
    EQ("=", false),
    NE("<>", false),
    LT("<", false),
    LTE("<=", false),
    GT(">", false),
    GTE(">=", false),

    // Arithmetic
    ADD("+", false),
    SUBTRACT("-", false),
    MULTIPLY("*", false),
    DIVIDE("/", false),
    NEGATE("-", true);

    private final String symbol;
    private final boolean unary;

    Operator(String symbol, boolean unary) {
        this.symbol = symbol;
        this.unary = unary;
    }

    /**
     * Symbol as written in formulas, also used as the operator name in provenance graphs.
     */
    public String symbol() {
        return symbol;
    }

    public boolean isUnary() {
        return unary;
    }
}
