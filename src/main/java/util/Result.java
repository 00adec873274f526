package util;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an error. Used by the per-file conversion steps so a failure travels
 * back to the batch loop as data instead of an exception.
 *
 * @param <T> value type
 * @param <E> error type
 */
public final class Result<T, E> {

    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T, E> Result<T, E> failure(E error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null)
            throw new IllegalStateException("Result holds an error: " + error);
        return value;
    }

    public E error() {
        if (error == null)
            throw new IllegalStateException("Result holds a value");
        return error;
    }

    /** Applies {@code next} to the value; errors pass through untouched. */
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> next) {
        if (error != null)
            return (Result<U, E>) this;
        return next.apply(value);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Failure[" + error + "]";
    }
}
