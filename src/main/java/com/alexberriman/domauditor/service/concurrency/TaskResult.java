package com.alexberriman.domauditor.service.concurrency;

import com.alexberriman.domauditor.exception.ConcurrencyException;

import java.util.Objects;

/**
 * Outcome of a task run through the concurrency core: either a value or a
 * {@link ConcurrencyException} describing why there is none.
 *
 * <p>A successful result may carry a {@code null} value (e.g. for {@code Void} tasks).
 *
 * @param <T> value type
 */
public final class TaskResult<T> {

    private final T value;
    private final ConcurrencyException error;

    private TaskResult(T value, ConcurrencyException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> TaskResult<T> success(T value) {
        return new TaskResult<>(value, null);
    }

    public static <T> TaskResult<T> failure(ConcurrencyException error) {
        return new TaskResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @return the task's value
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error.getMessage(), error);
        }
        return value;
    }

    /**
     * @return the failure description
     * @throws IllegalStateException if this result is a success
     */
    public ConcurrencyException getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    /**
     * @return the failure message, or {@code null} for a success
     */
    public String getErrorMessage() {
        return error == null ? null : error.getMessage();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskResult<?> other)) {
            return false;
        }
        if (isSuccess() != other.isSuccess()) {
            return false;
        }
        return isSuccess()
                ? Objects.equals(value, other.value)
                : Objects.equals(error.getMessage(), other.error.getMessage());
    }

    @Override
    public int hashCode() {
        return isSuccess() ? Objects.hash(true, value) : Objects.hash(false, error.getMessage());
    }

    @Override
    public String toString() {
        return isSuccess() ? "success(" + value + ")" : "failure(" + error.getMessage() + ")";
    }
}
