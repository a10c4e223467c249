package com.questrail.ocmf.observability;

import java.time.Instant;

/**
 * Record representing a successfully decoded OCMF record.
 */
public record OcmfParsedEvent(
    Instant timestamp,
    String pagination,
    String serialNumber,
    int readingCount,
    boolean hexEncoded
) {
}
