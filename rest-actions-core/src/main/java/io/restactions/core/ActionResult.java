package io.restactions.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Outcome of a dispatched action: either a value or a {@link ClassifiedError}.
 *
 * <p>Every resource operation returns one of these instead of throwing, so failure
 * paths stay visible at the call site. {@link #orThrow()} converts back to exceptions
 * for callers that prefer them.
 *
 * @param <T> the success value type
 */
public sealed interface ActionResult<T> permits ActionResult.Success, ActionResult.Failure {

    static <T> ActionResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ActionResult<T> failure(ClassifiedError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The value on success, empty on failure (or when the success value is null).
     */
    Optional<T> toOptional();

    /**
     * The error on failure, empty on success.
     */
    Optional<ClassifiedError> failureCause();

    <R> ActionResult<R> map(Function<? super T, ? extends R> mapper);

    <R> ActionResult<R> flatMap(Function<? super T, ActionResult<R>> mapper);

    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<ClassifiedError, ? extends R> onFailure);

    /**
     * Returns the value or throws the {@link RestActionException} matching the error kind.
     */
    T orThrow();

    T orElse(T fallback);

    /**
     * Rewrites the error of a failure; successes pass through.
     */
    default ActionResult<T> mapError(UnaryOperator<ClassifiedError> mapper) {
        if (this instanceof Failure<T> f) return new Failure<>(mapper.apply(f.error()));
        return this;
    }

    default ActionResult<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> s) action.accept(s.value());
        return this;
    }

    default ActionResult<T> onFailure(Consumer<ClassifiedError> action) {
        if (this instanceof Failure<T> f) action.accept(f.error());
        return this;
    }

    record Success<T>(T value) implements ActionResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public Optional<ClassifiedError> failureCause() {
            return Optional.empty();
        }

        @Override
        public <R> ActionResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> ActionResult<R> flatMap(Function<? super T, ActionResult<R>> mapper) {
            return Objects.requireNonNull(mapper.apply(value), "mapper result");
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<ClassifiedError, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }

        @Override
        public T orThrow() {
            return value;
        }

        @Override
        public T orElse(T fallback) {
            return value;
        }
    }

    record Failure<T>(ClassifiedError error) implements ActionResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @SuppressWarnings("unchecked")
        public <R> Failure<R> cast() {
            return (Failure<R>) this;
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
        public Optional<ClassifiedError> failureCause() {
            return Optional.of(error);
        }

        @Override
        public <R> ActionResult<R> map(Function<? super T, ? extends R> mapper) {
            return cast();
        }

        @Override
        public <R> ActionResult<R> flatMap(Function<? super T, ActionResult<R>> mapper) {
            return cast();
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<ClassifiedError, ? extends R> onFailure) {
            return onFailure.apply(error);
        }

        @Override
        public T orThrow() {
            throw error.toException();
        }

        @Override
        public T orElse(T fallback) {
            return fallback;
        }
    }
}
