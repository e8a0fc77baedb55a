package com.rulebook.exception;

/**
 * Exception thrown when an AST cannot be translated to target source.
 */
public class CodeGenerationException extends RulebookException {

    public CodeGenerationException(String message) {
        super(message);
    }
}
