package com.rulebook.core;

/**
 * Pipeline stage at which a field failed.
 */
public enum CompileStage {
    LEX,
    PARSE,
    EVAL,
    CODEGEN
}
