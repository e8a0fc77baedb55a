package com.rulebook.core;

import com.rulebook.exception.RulebookException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of one pipeline stage for one field: a value or a {@link CompileError}.
 * Lets a failing field be reported without aborting its siblings.
 *
 * @param <T> Artifact type
 */
public final class FieldResult<T> {

    private final String field;
    private final T value;
    private final CompileError error;

    private FieldResult(String field, T value, CompileError error) {
        this.field = field;
        this.value = value;
        this.error = error;
    }

    public static <T> FieldResult<T> success(String field, T value) {
        return new FieldResult<>(field, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FieldResult<T> failure(CompileError error) {
        return new FieldResult<>(error.field(), null, error);
    }

    /**
     * Run a stage, turning a {@link RulebookException} into a failed result.
     */
    public static <T> FieldResult<T> attempt(String field, Supplier<T> stage) {
        try {
            return success(field, stage.get());
        } catch (RulebookException e) {
            return failure(CompileError.of(field, e));
        }
    }

    /**
     * Run the next stage on a successful value; a failure is carried over unchanged.
     */
    public <R> FieldResult<R> then(Function<? super T, ? extends R> stage) {
        if (error != null) {
            return failure(error);
        }
        return attempt(field, () -> stage.apply(value));
    }

    public String getField() {
        return field;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * The value of a successful result.
     *
     * @throws IllegalStateException if the result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw new IllegalStateException("Field " + error);
        }
        return value;
    }

    public Optional<CompileError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? field + "=" + value : error.toString();
    }
}
