package com.rulebook.core;

import com.rulebook.exception.CodeGenerationException;
import com.rulebook.exception.EvaluationException;
import com.rulebook.exception.LexException;
import com.rulebook.exception.RulebookException;

/**
 * Failure of a single field.
 *
 * @param field   Field name
 * @param stage   Stage that failed
 * @param message Error message
 */
public record CompileError(String field, CompileStage stage, String message) {

    /**
     * Classify an exception raised while processing a field.
     */
    public static CompileError of(String field, RulebookException e) {
        CompileStage stage;
        if (e instanceof LexException) {
            stage = CompileStage.LEX;
        } else if (e instanceof EvaluationException) {
            stage = CompileStage.EVAL;
        } else if (e instanceof CodeGenerationException) {
            stage = CompileStage.CODEGEN;
        } else {
            stage = CompileStage.PARSE;
        }
        return new CompileError(field, stage, e.getMessage());
    }

    @Override
    public String toString() {
        return field + " [" + stage + "]: " + message;
    }
}
