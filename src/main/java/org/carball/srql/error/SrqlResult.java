package org.carball.srql.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a successful value or an {@link SrqlError}. Public entry points return this so a
 * calling view can render the message and keep its current results on screen.
 */
public final class SrqlResult<T> {

    private final T value;
    private final SrqlError error;

    private SrqlResult(T value, SrqlError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> SrqlResult<T> ok(T value) {
        return new SrqlResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> SrqlResult<T> failure(SrqlError error) {
        return new SrqlResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> SrqlResult<T> failure(SrqlException e) {
        return failure(SrqlError.of(e));
    }

    public boolean isOk() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error.displayMessage());
        }
        return value;
    }

    public SrqlError getError() {
        if (error == null) {
            throw new IllegalStateException("Result is successful");
        }
        return error;
    }

    public <R> SrqlResult<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(error);
    }

    @Override
    public String toString() {
        return isOk() ? "SrqlResult[ok=" + value + "]" : "SrqlResult[error=" + error + "]";
    }
}
