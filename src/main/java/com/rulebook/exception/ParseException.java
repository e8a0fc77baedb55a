package com.rulebook.exception;

/**
 * Exception thrown when a token stream is not a well-formed formula.
 */
public class ParseException extends FormulaException {

    /**
     * Why parsing failed.
     */
    public enum Reason {
        UNEXPECTED_TOKEN,
        ARITY_MISMATCH
    }

    private final Reason reason;
    private final String expected;
    private final String found;
    private final String function;
    private final int expectedArity;
    private final int actualArity;

    private ParseException(Reason reason, String message, String formula, int position,
                           String expected, String found,
                           String function, int expectedArity, int actualArity) {
        super(message, formula, position);
        this.reason = reason;
        this.expected = expected;
        this.found = found;
        this.function = function;
        this.expectedArity = expectedArity;
        this.actualArity = actualArity;
    }

    public static ParseException unexpectedToken(String expected, String found, String formula, int position) {
        return new ParseException(Reason.UNEXPECTED_TOKEN,
                "Expected " + expected + " but found " + found,
                formula, position, expected, found, null, -1, -1);
    }

    public static ParseException arityMismatch(String function, int expected, int actual,
                                               String formula, int position) {
        return new ParseException(Reason.ARITY_MISMATCH,
                function + " takes " + expected + " arguments, got " + actual,
                formula, position, null, null, function, expected, actual);
    }

    public Reason getReason() {
        return reason;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public String getFunction() {
        return function;
    }

    public int getExpectedArity() {
        return expectedArity;
    }

    public int getActualArity() {
        return actualArity;
    }
}
