package com.rulebook.evaluation;

import com.rulebook.exception.EvaluationException;

/**
 * A three-valued field value: boolean, integer, string or null.
 * {@link Null} is distinct from {@code false} and from the empty string.
 */
public sealed interface Value {

    Value NULL = new Null();
    Value TRUE = new Bool(true);
    Value FALSE = new Bool(false);

    record Bool(boolean value) implements Value {
        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record Int(long value) implements Value {
        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record Str(String value) implements Value {
        public Str {
            if (value == null) {
                throw new IllegalArgumentException("String value cannot be null, use Value.NULL");
            }
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record Null() implements Value {
        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String asText() {
            return "";
        }
    }

    /**
     * Plain Java form: Boolean, Long, String or null.
     */
    Object toJava();

    /**
     * Canonical string form used by concatenation: {@code true}/{@code false},
     * decimal integers, the empty string for null.
     */
    String asText();

    /**
     * Identity test: only a boolean {@code true} is true. Null, integers and strings are not.
     */
    default boolean isTrue() {
        return this instanceof Bool b && b.value();
    }

    default boolean isNull() {
        return this instanceof Null;
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value of(long value) {
        return new Int(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new Str(value);
    }

    /**
     * Convert a plain Java value. Integral numbers become {@link Int}.
     *
     * @throws EvaluationException for unsupported types such as fractional numbers
     */
    static Value fromJava(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof Boolean b) {
            return of(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof String s) {
            return of(s);
        }
        throw EvaluationException.typeMismatch("Unsupported value type " + value.getClass().getSimpleName()
                + ": " + value);
    }
}
