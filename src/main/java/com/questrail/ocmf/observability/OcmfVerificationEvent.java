package com.questrail.ocmf.observability;

import java.time.Instant;

/**
 * Record representing a completed signature verification.
 */
public record OcmfVerificationEvent(
    Instant timestamp,
    String algorithm,
    String curve,
    int keySizeBits,
    boolean valid
) {
}
