/*
 * ThinFilm — Characteristic Matrix Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.thinfilm.core.math;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Success-or-error result of a fallible arithmetic operation.
 *
 * <p>The failure side carries the exact exception the throwing variant of the
 * operation would raise, so {@link #orElseThrow()} is equivalent to calling it.</p>
 *
 * @param <T> value type on success
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    record Success<T>(T value) implements Outcome<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<T>(RuntimeException cause) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(RuntimeException error) {
        return new Failure<>(error);
    }

    /**
     * Runs {@code operation}, capturing arithmetic and argument errors as a failure.
     */
    static <T> Outcome<T> attempt(Supplier<T> operation) {
        try {
            return success(operation.get());
        } catch (ArithmeticException | IllegalArgumentException | UnsupportedOperationException e) {
            return failure(e);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<RuntimeException> error() {
        if (this instanceof Failure<T> f) {
            return Optional.of(f.cause());
        }
        return Optional.empty();
    }

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> s) {
            return attempt(() -> mapper.apply(s.value()));
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    default <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (this instanceof Success<T> s) {
            return mapper.apply(s.value());
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw ((Failure<T>) this).cause();
    }
}
