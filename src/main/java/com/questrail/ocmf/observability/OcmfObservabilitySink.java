package com.questrail.ocmf.observability;

/**
 * Main interface for receiving OCMF processing events.
 * Implementations can provide logging, metrics, or auditing.
 */
public interface OcmfObservabilitySink {
    /**
     * Called when a record has been decoded and validated.
     * @param event the parse details
     */
    void onParsed(OcmfParsedEvent event);

    /**
     * Called when a signature verification completed, with either outcome.
     * @param event the verification details
     */
    void onVerification(OcmfVerificationEvent event);

    /**
     * Called when a compliance check finished.
     * @param event the check summary
     */
    void onComplianceCheck(OcmfComplianceEvent event);

    /**
     * Called when an operation failed with an error.
     * @param event the error event
     */
    void onError(OcmfErrorEvent event);
}
