package com.rulebook.codegen;

import java.util.List;

/**
 * Generated Java method for one calculated field.
 *
 * @param entityName   Owning entity
 * @param fieldName    Calculated field
 * @param methodName   Java method name, {@code calc<Field>}
 * @param dependencies Field names bound to the parameters, sorted
 * @param parameters   Java parameter names, one per dependency
 * @param expression   Body expression
 * @param source       Complete method source
 */
public record GeneratedFunction(
        String entityName,
        String fieldName,
        String methodName,
        List<String> dependencies,
        List<String> parameters,
        JavaExpression expression,
        String source
) {
    public GeneratedFunction {
        dependencies = List.copyOf(dependencies);
        parameters = List.copyOf(parameters);
    }
}
