package com.stellarcast.common.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a collaborator call: either a value or a categorized failure.
 *
 * @param <T> value type
 */
public sealed interface Outcome<T> {

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> failed(ErrorKind kind, String message) {
        return new Failed<>(kind, message);
    }

    boolean isOk();

    /**
     * The value of a successful outcome.
     *
     * @throws IllegalStateException if this outcome failed
     */
    T get();

    /** Failure kind, or null when successful. */
    ErrorKind errorKind();

    /** Failure message, or null when successful. */
    String message();

    default T orElse(T fallback) {
        return isOk() ? get() : fallback;
    }

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (isOk()) {
            return ok(mapper.apply(get()));
        }
        return failed(errorKind(), message());
    }

    record Ok<T>(T value) implements Outcome<T> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public ErrorKind errorKind() {
            return null;
        }

        @Override
        public String message() {
            return null;
        }
    }

    record Failed<T>(ErrorKind kind, String message) implements Outcome<T> {
        public Failed {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T get() {
            throw new IllegalStateException(kind + ": " + message);
        }

        @Override
        public ErrorKind errorKind() {
            return kind;
        }
    }
}
