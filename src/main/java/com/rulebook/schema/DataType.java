package com.rulebook.schema;

import com.rulebook.exception.SchemaException;

import java.util.Locale;

/**
 * Datatype of a field value.
 */
public enum DataType {
    BOOLEAN,
    INTEGER,
    STRING;

    /**
     * Parse a rulebook datatype name (case-insensitive). Null means STRING.
     */
    public static DataType fromName(String name) {
        if (name == null || name.isBlank()) {
            return STRING;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Unknown datatype '" + name + "'", e);
        }
    }

    public String rulebookName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
