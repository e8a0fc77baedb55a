package com.rulebook.dependency;

import java.util.List;

/**
 * Non-fatal diagnostic: these calculated fields could not be ordered because their
 * dependencies are circular or missing. They were placed together in the final level.
 *
 * @param entity Entity name
 * @param fields Unresolved fields, sorted by name
 */
public record DependencyCycle(String entity, List<String> fields) {

    public DependencyCycle {
        fields = List.copyOf(fields);
    }
}
