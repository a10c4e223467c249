package com.questrail.ocmf.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of OcmfObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jOcmfObservabilitySink implements OcmfObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOcmfObservabilitySink.class);

    @Override
    public void onParsed(OcmfParsedEvent event) {
        log.info("OCMF record {} parsed: serial={}, readings={}{}",
            event.pagination(),
            event.serialNumber(),
            event.readingCount(),
            event.hexEncoded() ? " (hex input)" : "");
    }

    @Override
    public void onVerification(OcmfVerificationEvent event) {
        if (event.valid()) {
            log.info("OCMF signature valid: {} ({}, {} bit key)",
                event.algorithm(), event.curve(), event.keySizeBits());
        } else {
            log.warn("OCMF signature INVALID: {} ({}, {} bit key)",
                event.algorithm(), event.curve(), event.keySizeBits());
        }
    }

    @Override
    public void onComplianceCheck(OcmfComplianceEvent event) {
        log.info("OCMF {} compliance: {} error(s), {} warning(s)",
            event.transactionPair() ? "transaction" : "record",
            event.errorCount(),
            event.warningCount());
    }

    @Override
    public void onError(OcmfErrorEvent event) {
        log.error("OCMF {} failed: {}", event.operation(), event.error(), event.cause());
    }
}
