package com.phoenixchannels;

import java.util.function.Function;

/**
 * Outcome of an operation whose failure callers are expected to handle, such as a connect
 * attempt or a frame write. Sealed so callers can branch with {@code instanceof}.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }
    }

    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        /**
         * Rethrows unchecked errors as they are; checked ones are wrapped.
         */
        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (error instanceof Error fatal) {
                throw fatal;
            }
            throw new ActorException("Operation failed", error);
        }
    }

    boolean isSuccess();

    T getOrThrow();

    default T getOrElse(T fallback) {
        return this instanceof Success<T> success ? success.value() : fallback;
    }

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> success) {
            return new Success<>(fn.apply(success.value()));
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
