package com.rulebook.compiler;

import com.rulebook.core.CompileError;
import com.rulebook.core.FieldResult;
import com.rulebook.dependency.LevelAssignment;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.schema.EntitySchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compilation artifacts of one entity.
 *
 * @param schema        Entity schema
 * @param levels        Evaluation order of the calculated fields
 * @param fields        Compiled calculated fields, in evaluation order
 * @param className     Fully qualified name of the generated class
 * @param source        Source of the generated class
 */
public record CompiledEntity(
        EntitySchema schema,
        LevelAssignment levels,
        Map<String, CompiledField> fields,
        String className,
        String source
) {
    public CompiledEntity {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String name() {
        return schema.name();
    }

    public Optional<CompiledField> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * Parse outcome per calculated field, as consumed by record evaluation.
     */
    public Map<String, FieldResult<FormulaNode>> formulas() {
        Map<String, FieldResult<FormulaNode>> formulas = new LinkedHashMap<>();
        fields.forEach((name, field) -> formulas.put(name, field.ast()));
        return formulas;
    }

    public List<CompileError> errors() {
        List<CompileError> errors = new ArrayList<>();
        for (CompiledField field : fields.values()) {
            errors.addAll(field.errors());
        }
        return errors;
    }
}
