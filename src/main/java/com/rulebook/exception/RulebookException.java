package com.rulebook.exception;

/**
 * Base exception for the rulebook compiler.
 */
public class RulebookException extends RuntimeException {

    public RulebookException(String message) {
        super(message);
    }

    public RulebookException(String message, Throwable cause) {
        super(message, cause);
    }
}
