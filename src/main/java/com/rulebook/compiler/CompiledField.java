package com.rulebook.compiler;

import com.rulebook.codegen.GeneratedFunction;
import com.rulebook.core.CompileError;
import com.rulebook.core.FieldResult;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.graph.ProvenanceGraph;
import com.rulebook.schema.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * Compilation artifacts of one calculated field.
 *
 * @param field        Field definition
 * @param level        1-based evaluation level
 * @param ast          Parse outcome
 * @param dependencies Sorted names of the fields the formula reads
 * @param function     Generated Java method
 * @param graph        Provenance graph
 */
public record CompiledField(
        Field field,
        int level,
        FieldResult<FormulaNode> ast,
        List<String> dependencies,
        FieldResult<GeneratedFunction> function,
        FieldResult<ProvenanceGraph> graph
) {
    public CompiledField {
        dependencies = List.copyOf(dependencies);
    }

    public String name() {
        return field.name();
    }

    public boolean isSuccess() {
        return ast.isSuccess() && function.isSuccess() && graph.isSuccess();
    }

    /**
     * Distinct errors of this field; a parse error is reported once, not per stage.
     */
    public List<CompileError> errors() {
        List<CompileError> errors = new ArrayList<>();
        ast.getError().ifPresent(errors::add);
        function.getError().filter(e -> !errors.contains(e)).ifPresent(errors::add);
        graph.getError().filter(e -> !errors.contains(e)).ifPresent(errors::add);
        return errors;
    }
}
