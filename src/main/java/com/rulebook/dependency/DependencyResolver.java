package com.rulebook.dependency;

import com.rulebook.exception.FormulaException;
import com.rulebook.formula.Formulas;
import com.rulebook.schema.EntitySchema;
import com.rulebook.schema.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Orders calculated fields into levels so each is computed after the fields it reads.
 * <p>
 * Each pass places every field whose dependencies are already assigned (initially
 * the raw fields) into the next level, sorted by name. When a pass finds nothing
 * ready, all remaining fields go into one final level and a {@link DependencyCycle}
 * is reported instead of failing.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private static final Comparator<Field> BY_NAME = Comparator.comparing(Field::name);

    /**
     * Resolve levels for an entity, parsing each formula. A formula that fails to
     * parse contributes no dependencies.
     */
    public LevelAssignment resolve(EntitySchema entity) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (Field field : entity.calculatedFields()) {
            try {
                dependencies.put(field.name(), DependencyCollector.fieldDependencies(Formulas.parse(field.formula())));
            } catch (FormulaException e) {
                log.warn("Failed to parse formula for {}.{}: {}", entity.name(), field.name(), e.getMessage());
                dependencies.put(field.name(), Set.of());
            }
        }
        return resolve(entity.name(), entity.calculatedFields(), entity.rawFieldNames(), dependencies);
    }

    /**
     * Resolve levels from precomputed dependency sets.
     *
     * @param entityName       Entity name, for diagnostics
     * @param calculatedFields Calculated fields to order
     * @param rawFieldNames    Fields available before any calculation
     * @param dependencies     Referenced names per calculated field; missing entries mean none
     */
    public LevelAssignment resolve(String entityName,
                                   List<Field> calculatedFields,
                                   Set<String> rawFieldNames,
                                   Map<String, ? extends Set<String>> dependencies) {
        Map<String, SortedSet<String>> fieldDeps = new HashMap<>();
        for (Field field : calculatedFields) {
            Set<String> deps = dependencies.get(field.name());
            fieldDeps.put(field.name(), Collections.unmodifiableSortedSet(
                    deps == null ? new TreeSet<>() : new TreeSet<>(deps)));
        }

        Map<String, SortedSet<String>> unknown = findUnknownReferences(
                entityName, calculatedFields, rawFieldNames, fieldDeps);

        List<List<Field>> levels = new ArrayList<>();
        Set<String> assigned = new HashSet<>(rawFieldNames);
        List<Field> remaining = new ArrayList<>(calculatedFields);
        DependencyCycle cycle = null;

        while (!remaining.isEmpty()) {
            List<Field> ready = new ArrayList<>();
            for (Field field : remaining) {
                if (assigned.containsAll(fieldDeps.get(field.name()))) {
                    ready.add(field);
                }
            }

            if (ready.isEmpty()) {
                List<Field> last = new ArrayList<>(remaining);
                last.sort(BY_NAME);
                levels.add(last);
                cycle = new DependencyCycle(entityName, last.stream().map(Field::name).toList());
                log.warn("Possible circular dependency in {}: {}", entityName, cycle.fields());
                break;
            }

            ready.sort(BY_NAME);
            levels.add(ready);
            for (Field field : ready) {
                assigned.add(field.name());
            }
            remaining.removeAll(ready);
            log.debug("{} level {}: {}", entityName, levels.size(), ready.stream().map(Field::name).toList());
        }

        return new LevelAssignment(levels, fieldDeps, unknown, Optional.ofNullable(cycle));
    }

    private Map<String, SortedSet<String>> findUnknownReferences(String entityName,
                                                                 List<Field> calculatedFields,
                                                                 Set<String> rawFieldNames,
                                                                 Map<String, SortedSet<String>> fieldDeps) {
        Set<String> known = new HashSet<>(rawFieldNames);
        calculatedFields.forEach(f -> known.add(f.name()));

        Map<String, SortedSet<String>> unknown = new TreeMap<>();
        for (Field field : calculatedFields) {
            SortedSet<String> missing = new TreeSet<>(fieldDeps.get(field.name()));
            missing.removeAll(known);
            if (!missing.isEmpty()) {
                unknown.put(field.name(), Collections.unmodifiableSortedSet(missing));
                log.warn("Field {}.{} references unknown fields {}", entityName, field.name(), missing);
            }
        }
        return unknown;
    }
}
