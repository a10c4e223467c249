package com.questrail.ocmf.error;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured description of a failure.
 *
 * <p>Section-level errors ({@link ErrorKind#PAYLOAD}, {@link ErrorKind#SIGNATURE})
 * usually wrap the {@link ErrorKind#VALIDATION} error that caused them via
 * {@link #nested()}. Failures raised by a third-party library are carried as
 * {@link #throwable()}.</p>
 *
 * @param kind      classification
 * @param message   human-readable diagnostic, including expected vs. actual where known
 * @param field     OCMF field name the error is about, or {@code null}
 * @param nested    underlying OCMF error, or {@code null}
 * @param throwable underlying library exception, or {@code null}
 */
public record OcmfError(
        ErrorKind kind,
        String message,
        String field,
        OcmfError nested,
        Throwable throwable
)
{
    public OcmfError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static OcmfError of(ErrorKind kind, String message) {
        return new OcmfError(kind, message, null, null, null);
    }

    public static OcmfError of(ErrorKind kind, String message, Throwable throwable) {
        return new OcmfError(kind, message, null, null, throwable);
    }

    public static OcmfError validation(String field, String message) {
        return new OcmfError(ErrorKind.VALIDATION, message, field, null, null);
    }

    /**
     * Wraps this error into a section-level error of the given kind, keeping
     * this error's field.
     */
    public OcmfError wrap(ErrorKind sectionKind, String prefix) {
        return new OcmfError(sectionKind, prefix + ": " + message, field, this, null);
    }

    public Optional<String> fieldName() {
        return Optional.ofNullable(field);
    }

    /**
     * Walks the nesting chain and returns the innermost error.
     */
    public OcmfError rootError() {
        OcmfError current = this;
        while (current.nested != null) {
            current = current.nested;
        }
        return current;
    }

    @Override
    public String toString() {
        return kind + (field != null ? "[" + field + "]" : "") + ": " + message;
    }
}
