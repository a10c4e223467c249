package com.questrail.ocmf.observability;

/**
 * No-op implementation of OcmfObservabilitySink.
 */
public final class NullObservabilitySink implements OcmfObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onParsed(OcmfParsedEvent event) {}

    @Override
    public void onVerification(OcmfVerificationEvent event) {}

    @Override
    public void onComplianceCheck(OcmfComplianceEvent event) {}

    @Override
    public void onError(OcmfErrorEvent event) {}
}
