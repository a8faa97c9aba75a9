package com.hawkguard.guard;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of evaluating a guard step: either a value or a classified failure.
 * <p>
 * Exactly one of {@link Success} and {@link Failure} holds. Steps are chained
 * with {@link #flatMap(Function)}; the first failure short-circuits the rest.
 *
 * @param <T> the success value type
 */
public sealed interface GuardOutcome<T> permits GuardOutcome.Success, GuardOutcome.Failure {

    static <T> GuardOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> GuardOutcome<T> failure(HawkError error, GuardStatus status) {
        return new Failure<>(error, status);
    }

    /** Failure with {@link HawkError#NO_HEADER} and the given status. */
    static <T> GuardOutcome<T> noHeader(GuardStatus status) {
        return new Failure<>(HawkError.NO_HEADER, status);
    }

    boolean isSuccess();

    /** The success value, or empty on failure. */
    Optional<T> toOptional();

    <U> GuardOutcome<U> map(Function<? super T, ? extends U> mapper);

    <U> GuardOutcome<U> flatMap(Function<? super T, GuardOutcome<U>> mapper);

    /**
     * Returns the success value or throws the failure as a {@link HawkGuardException}.
     *
     * @param headerName the header the outcome was evaluated for, recorded on the exception
     */
    T orElseThrow(String headerName);

    /**
     * The guard produced a value.
     *
     * @param value the value, never null
     */
    record Success<T>(T value) implements GuardOutcome<T> {

        public Success {
            Objects.requireNonNull(value, "value must not be null");
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
        public <U> GuardOutcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> GuardOutcome<U> flatMap(Function<? super T, GuardOutcome<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public T orElseThrow(String headerName) {
            return value;
        }
    }

    /**
     * The guard failed.
     *
     * @param error what went wrong
     * @param status the status the host should answer with
     */
    record Failure<T>(HawkError error, GuardStatus status) implements GuardOutcome<T> {

        public Failure {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(status, "status must not be null");
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
        public <U> GuardOutcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error, status);
        }

        @Override
        public <U> GuardOutcome<U> flatMap(Function<? super T, GuardOutcome<U>> mapper) {
            return new Failure<>(error, status);
        }

        @Override
        public T orElseThrow(String headerName) {
            throw new HawkGuardException(headerName, error, status);
        }
    }
}
