package com.rulebook.compiler;

import com.rulebook.core.CompileError;
import com.rulebook.dependency.DependencyCycle;
import com.rulebook.schema.Rulebook;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled rulebook. Failed fields are reported here rather than thrown.
 *
 * @param rulebook Source rulebook
 * @param entities Compiled entities, in document order
 */
public record CompilationResult(Rulebook rulebook, Map<String, CompiledEntity> entities) {

    public CompilationResult {
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    }

    public Optional<CompiledEntity> entity(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    public List<CompileError> errors() {
        List<CompileError> errors = new ArrayList<>();
        for (CompiledEntity entity : entities.values()) {
            errors.addAll(entity.errors());
        }
        return errors;
    }

    public List<DependencyCycle> cycles() {
        List<DependencyCycle> cycles = new ArrayList<>();
        for (CompiledEntity entity : entities.values()) {
            entity.levels().cycle().ifPresent(cycles::add);
        }
        return cycles;
    }

    public boolean isSuccess() {
        return errors().isEmpty();
    }
}
