package com.querygen.compiler.error;

import java.util.List;
import java.util.function.Function;

/**
 * Either a stage value or the complete batch of errors the stage found.
 *
 * @param <T> the success value type
 */
public final class StageResult<T> {

    private final T value;
    private final List<ValidationError> errors;

    private StageResult(T value, List<ValidationError> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(value, List.of());
    }

    public static <T> StageResult<T> failed(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed stage result needs at least one error");
        }
        return new StageResult<>(null, List.copyOf(errors));
    }

    /**
     * Ok when the error batch is empty, failed otherwise.
     */
    public static <T> StageResult<T> of(T value, List<ValidationError> errors) {
        return errors.isEmpty() ? ok(value) : failed(errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public T getValue() {
        if (!isOk()) {
            throw new IllegalStateException("Stage failed with " + errors.size() + " error(s)");
        }
        return value;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public <R> StageResult<R> map(Function<T, R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : new StageResult<>(null, errors);
    }
}
