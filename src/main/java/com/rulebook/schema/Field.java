package com.rulebook.schema;

import com.rulebook.exception.SchemaException;


/**
 * Field definition of an entity.
 *
 * @param name        Field name, unique within the entity
 * @param datatype    Value datatype
 * @param kind        RAW or CALCULATED
 * @param formula     Formula text; present exactly when the field is calculated
 * @param nullable    Whether the field may be absent
 * @param description Free-text description, may be null
 */
public record Field(
        String name,
        DataType datatype,
        FieldKind kind,
        String formula,
        boolean nullable,
        String description
) {
    public Field {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Field name cannot be blank");
        }
        if (datatype == null) {
            datatype = DataType.STRING;
        }
        if (kind == null) {
            kind = FieldKind.RAW;
        }
        if (kind == FieldKind.RAW && formula != null && !formula.isBlank()) {
            throw new SchemaException("Raw field '" + name + "' cannot have a formula");
        }
        if (kind == FieldKind.CALCULATED && (formula == null || formula.isBlank())) {
            throw new SchemaException("Calculated field '" + name + "' requires a formula");
        }
        if (kind == FieldKind.RAW) {
            formula = null;
        }
    }

    /**
     * Create a nullable raw field.
     */
    public static Field raw(String name, DataType datatype) {
        return new Field(name, datatype, FieldKind.RAW, null, true, null);
    }

    /**
     * Create a calculated field.
     */
    public static Field calculated(String name, DataType datatype, String formula) {
        return new Field(name, datatype, FieldKind.CALCULATED, formula, true, null);
    }

    public boolean isCalculated() {
        return kind == FieldKind.CALCULATED;
    }
}
