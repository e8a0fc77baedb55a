package com.rulebook.compiler;

import com.rulebook.exception.RulebookException;

/**
 * Compiler configuration.
 *
 * @param parallelism        Entities compiled concurrently
 * @param generatedPackage   Package of the generated calculation classes
 * @param blankStringsAsNull Whether string fields that compute to "" become null
 */
public record CompilerSettings(int parallelism, String generatedPackage, boolean blankStringsAsNull) {

    public static final String DEFAULT_PACKAGE = "com.rulebook.generated";

    public CompilerSettings {
        if (parallelism < 1) {
            throw new RulebookException("Compiler parallelism must be at least 1, got " + parallelism);
        }
        if (generatedPackage == null) {
            generatedPackage = DEFAULT_PACKAGE;
        }
        if (!generatedPackage.isEmpty() && !generatedPackage.matches("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*")) {
            throw new RulebookException("Invalid generated package name: " + generatedPackage);
        }
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(Runtime.getRuntime().availableProcessors(), DEFAULT_PACKAGE, true);
    }

    public CompilerSettings withParallelism(int parallelism) {
        return new CompilerSettings(parallelism, generatedPackage, blankStringsAsNull);
    }
}
