package com.amannmalik.ucp.api.shared;

import com.amannmalik.ucp.util.Ensure;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a merchant call: either a value or exactly one {@link UcpError}.
 * Failures propagate through {@link #map} and {@link #flatMap} untouched.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UcpError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    Optional<T> toOptional();

    Optional<UcpError> error();

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    /// Replaces a failure with the value produced from it. Successes pass through.
    Result<T> recover(Function<? super UcpError, ? extends T> fallback);

    Result<T> onFailure(Consumer<? super UcpError> action);

    T orElseThrow();

    record Success<T>(T value) implements Result<T> {
        public Success {
            value = Ensure.notNull("result.value", value);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.of(value);
        }

        @Override
        public Optional<UcpError> error() {
            return Optional.empty();
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return Ensure.notNull("result.flat_map", mapper.apply(value));
        }

        @Override
        public Result<T> recover(Function<? super UcpError, ? extends T> fallback) {
            return this;
        }

        @Override
        public Result<T> onFailure(Consumer<? super UcpError> action) {
            return this;
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    record Failure<T>(UcpError cause) implements Result<T> {
        public Failure {
            cause = Ensure.notNull("result.error", cause);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public Optional<UcpError> error() {
            return Optional.of(cause);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public Result<T> recover(Function<? super UcpError, ? extends T> fallback) {
            return new Success<>(fallback.apply(cause));
        }

        @Override
        public Result<T> onFailure(Consumer<? super UcpError> action) {
            action.accept(cause);
            return this;
        }

        @Override
        public T orElseThrow() {
            throw new UcpClientException(cause);
        }
    }
}
