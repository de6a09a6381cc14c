package com.openrangelabs.copilot.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a connector operation: exactly one of {@link Ok} or {@link Err}.
 *
 * <p>Connectors never signal failures as exceptions; callers consume the result
 * with {@link #fold(Function, Function)}, which forces both branches to be handled.
 *
 * @param <T> type of the success value
 */
public abstract class ConnectorResult<T> {

    private ConnectorResult() {
    }

    public static <T> ConnectorResult<T> ok(T value) {
        return new Ok<>(value);
    }

    public static <T> ConnectorResult<T> err(ErrorInfo error) {
        return new Err<>(error);
    }

    public abstract boolean isOk();

    public boolean isErr() {
        return !isOk();
    }

    /**
     * @throws IllegalStateException if this is an {@link Err}
     */
    public abstract T getValue();

    /**
     * @throws IllegalStateException if this is an {@link Ok}
     */
    public abstract ErrorInfo getError();

    public abstract <R> R fold(Function<? super T, ? extends R> onOk,
                               Function<? super ErrorInfo, ? extends R> onErr);

    /**
     * Transforms the success value; an error passes through unchanged.
     */
    public <U> ConnectorResult<U> map(Function<? super T, ? extends U> mapper) {
        return fold(value -> ok(mapper.apply(value)), ConnectorResult::err);
    }

    /**
     * Chains a step that can itself fail; an error passes through unchanged.
     */
    public <U> ConnectorResult<U> flatMap(Function<? super T, ConnectorResult<U>> mapper) {
        return fold(mapper::apply, ConnectorResult::err);
    }

    public static final class Ok<T> extends ConnectorResult<T> {

        private final T value;

        private Ok(T value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public ErrorInfo getError() {
            throw new IllegalStateException("Ok result carries no error");
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk,
                          Function<? super ErrorInfo, ? extends R> onErr) {
            return onOk.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ok && value.equals(((Ok<?>) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Ok{" + value + '}';
        }
    }

    public static final class Err<T> extends ConnectorResult<T> {

        private final ErrorInfo error;

        private Err(ErrorInfo error) {
            this.error = Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Err result carries no value: " + error.getMessage());
        }

        @Override
        public ErrorInfo getError() {
            return error;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk,
                          Function<? super ErrorInfo, ? extends R> onErr) {
            return onErr.apply(error);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Err && error.equals(((Err<?>) o).error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }

        @Override
        public String toString() {
            return "Err{" + error + '}';
        }
    }
}
