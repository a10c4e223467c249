package com.questrail.ocmf.error;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an operation that may fail with an {@link OcmfError}.
 *
 * @param <T> success value type
 */
public sealed interface OcmfResult<T> permits OcmfResult.Success, OcmfResult.Failure
{
    record Success<T>(T get) implements OcmfResult<T>
    {
        public Success {
            Objects.requireNonNull(get, "get");
        }
    }

    record Failure<T>(OcmfError cause) implements OcmfResult<T>
    {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }
    }

    static <T> OcmfResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> OcmfResult<T> failure(OcmfError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> value() {
        if (this instanceof Success<T> s) {
            return Optional.of(s.get());
        }
        return Optional.empty();
    }

    default Optional<OcmfError> error() {
        if (this instanceof Failure<T> f) {
            return Optional.of(f.cause());
        }
        return Optional.empty();
    }

    default <U> OcmfResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> s) {
            return success(mapper.apply(s.get()));
        }
        return failure(((Failure<T>) this).cause());
    }

    default <U> OcmfResult<U> flatMap(Function<? super T, OcmfResult<U>> mapper) {
        if (this instanceof Success<T> s) {
            return mapper.apply(s.get());
        }
        return failure(((Failure<T>) this).cause());
    }

    /**
     * @throws OcmfException carrying the error if this is a failure
     */
    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.get();
        }
        throw new OcmfException(((Failure<T>) this).cause());
    }
}
