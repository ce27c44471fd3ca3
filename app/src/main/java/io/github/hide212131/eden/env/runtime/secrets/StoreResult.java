package io.github.hide212131.eden.env.runtime.secrets;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one {@link LocalEncryptedStore} operation. Store operations never leak raw exceptions;
 * callers that prefer them use {@link #orElseThrow()}.
 */
public sealed interface StoreResult<T> permits StoreResult.Success, StoreResult.Failure {

    static <T> StoreResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StoreResult<T> failure(StoreFailure failure, String message) {
        return new Failure<>(failure, message);
    }

    boolean isSuccess();

    T orElseThrow();

    <R> StoreResult<R> map(Function<T, R> mapper);

    record Success<T>(T value) implements StoreResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <R> StoreResult<R> map(Function<T, R> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T>(StoreFailure failure, String message) implements StoreResult<T> {
        public Failure {
            Objects.requireNonNull(failure, "failure");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T orElseThrow() {
            throw new KeyStateException(failure, message);
        }

        @Override
        public <R> StoreResult<R> map(Function<T, R> mapper) {
            return new Failure<>(failure, message);
        }
    }
}
