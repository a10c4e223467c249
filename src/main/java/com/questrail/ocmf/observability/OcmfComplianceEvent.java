package com.questrail.ocmf.observability;

import java.time.Instant;

/**
 * Record summarizing one compliance check.
 */
public record OcmfComplianceEvent(
    Instant timestamp,
    boolean transactionPair,
    int errorCount,
    int warningCount
) {
    public boolean isCompliant() {
        return errorCount == 0;
    }
}
