package org.calista.accuracy.error;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome — explicit success/failure value returned by failable factories.
 *
 * <p>Exactly one of {@link #value()} / {@link #error()} is meaningful.
 * A successful outcome may carry a {@code null} value (e.g. selection over an empty result).
 */
public final class Outcome<T> {

    private final T value;
    private final ErrorCode error;

    private Outcome(T value, ErrorCode error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(ErrorCode error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /** @throws NoSuchElementException when this is a failure */
    public T value() {
        if (error != null) throw new NoSuchElementException("Outcome failed: " + error.label());
        return value;
    }

    /** @return failure code, or {@code null} on success */
    public ErrorCode error() {
        return error;
    }

    /**
     * Chains another failable step; failures short-circuit with their original code.
     */
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> next) {
        Objects.requireNonNull(next, "next");
        if (error != null) return failure(error);
        return Objects.requireNonNull(next.apply(value), "next returned null");
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        if (error != null) return failure(error);
        return ok(fn.apply(value));
    }

    /**
     * Raising unwrap.
     *
     * @param subject type name used in the exception message ("Invalid {subject}: {code}")
     */
    public T orElseThrow(String subject) {
        if (error != null) throw new AccuracyException(subject, error);
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Outcome<?> o)) return false;
        return error == o.error && Objects.equals(value, o.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return (error == null) ? "Outcome{ok=" + value + '}' : "Outcome{error=" + error.label() + '}';
    }
}
