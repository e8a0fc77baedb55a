package com.rulebook.exception;

/**
 * Exception thrown when a formula cannot be evaluated against a record.
 * Fails a single field, never the whole record.
 */
public class EvaluationException extends RulebookException {

    /**
     * Why evaluation failed.
     */
    public enum Reason {
        TYPE_MISMATCH,
        UNKNOWN_FUNCTION,
        ARITY_MISMATCH
    }

    private final Reason reason;

    public EvaluationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static EvaluationException typeMismatch(String message) {
        return new EvaluationException(Reason.TYPE_MISMATCH, message);
    }

    public Reason getReason() {
        return reason;
    }
}
