package com.rulebook.dependency;

import com.rulebook.schema.Field;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Evaluation order of an entity's calculated fields.
 * <p>
 * Level 0 (raw fields) is implicit; {@code levels().get(0)} is level 1.
 *
 * @param levels            Calculated fields per level, each level sorted by name
 * @param dependencies      Referenced field names per calculated field
 * @param unknownReferences Referenced names that are neither raw nor calculated fields
 * @param cycle             Present when some fields could not be ordered
 */
public record LevelAssignment(
        List<List<Field>> levels,
        Map<String, SortedSet<String>> dependencies,
        Map<String, SortedSet<String>> unknownReferences,
        Optional<DependencyCycle> cycle
) {
    public LevelAssignment {
        levels = levels.stream().map(List::copyOf).toList();
        dependencies = Map.copyOf(dependencies);
        unknownReferences = Map.copyOf(unknownReferences);
    }

    public boolean hasCycle() {
        return cycle.isPresent();
    }

    /**
     * Calculated field names flattened in evaluation order.
     */
    public List<String> calcOrder() {
        List<String> order = new ArrayList<>();
        for (List<Field> level : levels) {
            for (Field field : level) {
                order.add(field.name());
            }
        }
        return order;
    }

    /**
     * 1-based level of a calculated field, or 0 if it is not calculated here.
     */
    public int levelOf(String fieldName) {
        for (int i = 0; i < levels.size(); i++) {
            for (Field field : levels.get(i)) {
                if (field.name().equals(fieldName)) {
                    return i + 1;
                }
            }
        }
        return 0;
    }

    /**
     * Sorted dependency names of a calculated field; empty when unknown.
     */
    public List<String> dependencyOrder(String fieldName) {
        SortedSet<String> deps = dependencies.get(fieldName);
        return deps == null ? List.of() : List.copyOf(deps);
    }

    /**
     * {@code [dependency, dependent]} pairs, dependents in evaluation order.
     */
    public List<List<String>> dependencyEdges() {
        List<List<String>> edges = new ArrayList<>();
        for (String dependent : calcOrder()) {
            for (String dependency : dependencyOrder(dependent)) {
                edges.add(List.of(dependency, dependent));
            }
        }
        return edges;
    }
}
