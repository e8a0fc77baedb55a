package com.rulebook.schema;

import com.rulebook.exception.SchemaException;

import java.util.Locale;

/**
 * Whether a field is supplied by the caller or computed from a formula.
 */
public enum FieldKind {
    RAW,
    CALCULATED;

    public static FieldKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return RAW;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Unknown field type '" + name + "'", e);
        }
    }

    public String rulebookName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
