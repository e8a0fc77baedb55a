package com.rulebook.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable mapping from field name to value. Absent fields read as {@link Value#NULL}.
 */
public final class FieldRecord {

    private static final FieldRecord EMPTY = new FieldRecord(Map.of());

    private final Map<String, Value> values;

    private FieldRecord(Map<String, Value> values) {
        this.values = values;
    }

    public static FieldRecord empty() {
        return EMPTY;
    }

    /**
     * Build a record from plain Java values (Boolean, integral Number, String, null).
     */
    public static FieldRecord of(Map<String, ?> values) {
        Map<String, Value> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            converted.put(entry.getKey(), Value.fromJava(entry.getValue()));
        }
        return new FieldRecord(Collections.unmodifiableMap(converted));
    }

    public Value get(String field) {
        return values.getOrDefault(field, Value.NULL);
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    /**
     * Copy of this record with one field set.
     */
    public FieldRecord with(String field, Value value) {
        Map<String, Value> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new FieldRecord(Collections.unmodifiableMap(copy));
    }

    public Map<String, Value> values() {
        return values;
    }

    /**
     * Plain Java view, null for absent values.
     */
    public Map<String, Object> toJava() {
        Map<String, Object> result = new LinkedHashMap<>();
        values.forEach((k, v) -> result.put(k, v.toJava()));
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldRecord other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
