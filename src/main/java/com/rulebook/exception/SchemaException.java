package com.rulebook.exception;

/**
 * Exception thrown when a rulebook document or entity schema is invalid.
 * Raised while loading, before any formula is compiled.
 */
public class SchemaException extends RulebookException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
