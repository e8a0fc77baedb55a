package com.rulebook.schema;

import com.rulebook.exception.SchemaException;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered field definitions of one entity.
 *
 * @param name        Entity name
 * @param fields      Fields in document order
 * @param description Free-text description, may be null
 */
public record EntitySchema(String name, List<Field> fields, String description) {

    public EntitySchema {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Entity name cannot be blank");
        }
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (Field field : fields) {
            if (!seen.add(field.name())) {
                throw new SchemaException("Duplicate field '" + field.name() + "' in entity '" + name + "'");
            }
        }
    }

    public EntitySchema(String name, List<Field> fields) {
        this(name, fields, null);
    }

    public List<Field> calculatedFields() {
        return fields.stream().filter(Field::isCalculated).toList();
    }

    public List<Field> rawFields() {
        return fields.stream().filter(f -> !f.isCalculated()).toList();
    }

    public Set<String> rawFieldNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Field field : rawFields()) {
            names.add(field.name());
        }
        return names;
    }

    public Optional<Field> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    /**
     * The identifying field: the first non-nullable one.
     */
    public Optional<Field> idField() {
        return fields.stream().filter(f -> !f.nullable()).findFirst();
    }
}
