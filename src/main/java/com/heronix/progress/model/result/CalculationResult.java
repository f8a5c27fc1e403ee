package com.heronix.progress.model.result;

import java.util.function.Function;

/**
 * Outcome of a calculation: either a value or a {@link DomainError}.
 *
 * Lets callers tell "evaluated, but not eligible" apart from "could not be evaluated"
 * without catching exceptions.
 *
 * @param <T> the value type on success
 */
public record CalculationResult<T>(
        boolean success,
        T value,
        DomainError error
) {
    public static <T> CalculationResult<T> success(T value) {
        return new CalculationResult<>(true, value, null);
    }

    public static <T> CalculationResult<T> failure(DomainError error) {
        return new CalculationResult<>(false, null, error);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Get the value, or throw if this is a failure. Intended for tests and for callers
     * that already checked {@link #success()}.
     */
    public T orElseThrow() {
        if (!success) {
            throw new IllegalStateException(error.code() + ": " + error.message());
        }
        return value;
    }

    public <U> CalculationResult<U> map(Function<T, U> mapper) {
        return success ? success(mapper.apply(value)) : failure(error);
    }

    public <U> CalculationResult<U> flatMap(Function<T, CalculationResult<U>> mapper) {
        return success ? mapper.apply(value) : failure(error);
    }
}
