package com.questrail.ocmf.observability;

import com.questrail.ocmf.error.OcmfError;

import java.time.Instant;

/**
 * Record representing a failed parse or verification.
 */
public record OcmfErrorEvent(
    Instant timestamp,
    String operation,
    OcmfError error
) {
    /**
     * Library exception at the root of the error chain, or {@code null}.
     */
    public Throwable cause() {
        return error.rootError().throwable() != null ? error.rootError().throwable() : error.throwable();
    }
}
