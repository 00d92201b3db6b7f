package com.eventengine.platform.base;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Outcome of a fallible call: a value, or the Throwable that prevented it.
 *
 * Event engine, event store and document store calls all return a Result, and the
 * HTTP layer folds failures into error responses at the very end:
 *
 * <pre>{@code
 * facade.loadAggregateState(type, id, version)
 *       .fold(ErrorResponses::from, ResponseEntity::ok);
 * }</pre>
 *
 * Every combinator is derived from {@link #fold}.
 *
 * @param <A> The success value type
 */
public sealed interface Result<A> permits Result.Success, Result.Failure {

    <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess);

    // ========================================================================
    // Inspection
    // ========================================================================

    default boolean isSuccess() {
        return fold(e -> false, a -> true);
    }

    default boolean isFailure() {
        return !isSuccess();
    }

    default Optional<Throwable> error() {
        return fold(Optional::of, a -> Optional.empty());
    }

    /**
     * The value, or the failure rethrown. Checked causes are wrapped in a RuntimeException.
     */
    default A getOrThrow() {
        return fold(e -> {
            if (e instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e instanceof Error error) {
                throw error;
            }
            throw new RuntimeException(e);
        }, Function.identity());
    }

    // ========================================================================
    // Combinators
    // ========================================================================

    default <B> Result<B> map(Function<A, B> f) {
        return flatMap(a -> of(() -> f.apply(a)));
    }

    default <B> Result<B> flatMap(Function<A, Result<B>> f) {
        return fold(Result::failure, f);
    }

    /**
     * Keep the value if it passes {@code predicate}, otherwise fail with the error built from it.
     */
    default Result<A> filterOrElse(Predicate<A> predicate, Function<A, Throwable> errorFor) {
        return flatMap(a -> predicate.test(a) ? this : failure(errorFor.apply(a)));
    }

    default Result<A> onSuccess(Consumer<A> action) {
        if (this instanceof Success<A> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<A> onFailure(Consumer<Throwable> action) {
        if (this instanceof Failure<A> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    // ========================================================================
    // Factories
    // ========================================================================

    static <A> Result<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Result<A> failure(Throwable error) {
        return new Failure<>(error);
    }

    static <A> Result<A> failure(String message) {
        return new Failure<>(new RuntimeException(message));
    }

    /**
     * Run {@code supplier}, capturing anything it throws.
     */
    static <A> Result<A> of(ThrowingSupplier<A> supplier) {
        try {
            return success(supplier.get());
        } catch (Throwable t) {
            return failure(t);
        }
    }

    /**
     * All values in order, or the first failure.
     */
    static <A> Result<List<A>> sequence(List<Result<A>> results) {
        List<A> values = new ArrayList<>(results.size());
        for (Result<A> result : results) {
            if (result instanceof Failure<A> failure) {
                return failure(failure.cause());
            }
            values.add(((Success<A>) result).value());
        }
        return success(values);
    }

    @FunctionalInterface
    interface ThrowingSupplier<A> {
        A get() throws Exception;
    }

    record Success<A>(A value) implements Result<A> {
        @Override
        public <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<A>(Throwable cause) implements Result<A> {
        public Failure {
            Objects.requireNonNull(cause, "cause cannot be null");
        }

        @Override
        public <B> B fold(Function<Throwable, B> onFailure, Function<A, B> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
