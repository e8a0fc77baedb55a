package com.rulebook.exception;

/**
 * Base exception for malformed formula text.
 * Carries the formula and the character offset where the problem was found.
 */
public abstract class FormulaException extends RulebookException {

    private final String formula;
    private final int position;

    protected FormulaException(String message, String formula, int position) {
        super("Invalid formula at position " + position + ": " + message + " in '" + formula + "'");
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() {
        return formula;
    }

    public int getPosition() {
        return position;
    }
}
