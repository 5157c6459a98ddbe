package com.pulsesystems;

import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result type for explicit error handling without stack unwinding.
 * Sealed so callers can rely on exactly two shapes.
 *
 * @param <T> the success value type
 * @param <E> the failure value type
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public E failure() {
            throw new NoSuchElementException("Result is a success");
        }
    }

    /**
     * Failed result containing a typed failure value.
     */
    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public E failure() {
            return error;
        }
    }

    boolean isSuccess();

    T getOrElse(T defaultValue);

    /**
     * Returns the failure value.
     *
     * @throws NoSuchElementException if this is a success
     */
    E failure();

    /**
     * Returns the success value or throws the exception built from the failure.
     */
    default <X extends RuntimeException> T getOrThrow(Function<? super E, X> exceptionFactory) {
        if (this instanceof Success<T, E> success) {
            return success.value();
        }
        throw exceptionFactory.apply(failure());
    }

    default <U> Result<U, E> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Success<T, E> success) {
            return new Success<>(fn.apply(success.value()));
        }
        return new Failure<>(failure());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> fn) {
        if (this instanceof Success<T, E> success) {
            return fn.apply(success.value());
        }
        return new Failure<>(failure());
    }

    default void ifSuccess(Consumer<? super T> consumer) {
        if (this instanceof Success<T, E> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<? super E> consumer) {
        if (this instanceof Failure<T, E> failed) {
            consumer.accept(failed.error());
        }
    }

    // Factory methods
    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
