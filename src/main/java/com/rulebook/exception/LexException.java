package com.rulebook.exception;

/**
 * Exception thrown when formula text cannot be split into tokens.
 */
public class LexException extends FormulaException {

    /**
     * Why tokenizing failed.
     */
    public enum Reason {
        UNTERMINATED_STRING,
        UNEXPECTED_CHARACTER
    }

    private final Reason reason;

    public LexException(Reason reason, String message, String formula, int position) {
        super(message, formula, position);
        this.reason = reason;
    }

    public static LexException unterminatedString(String formula, int position) {
        return new LexException(Reason.UNTERMINATED_STRING, "Unterminated string", formula, position);
    }

    public static LexException unexpectedCharacter(String detail, String formula, int position) {
        return new LexException(Reason.UNEXPECTED_CHARACTER, detail, formula, position);
    }

    public Reason getReason() {
        return reason;
    }
}
