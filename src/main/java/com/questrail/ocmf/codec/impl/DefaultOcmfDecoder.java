package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.ocmf.codec.OcmfDecoder;
import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Signature;
import com.questrail.ocmf.observability.NullObservabilitySink;
import com.questrail.ocmf.observability.OcmfErrorEvent;
import com.questrail.ocmf.observability.OcmfObservabilitySink;
import com.questrail.ocmf.observability.OcmfParsedEvent;
import com.questrail.ocmf.validation.OcmfValidationConfig;
import com.questrail.ocmf.validation.PayloadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * DefaultOcmfDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OcmfDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Trim and hex auto-detection ({@link ErrorKind#HEX_ENCODING} on failure)</li>
 *   <li>Section split ({@link ErrorKind#FORMAT} on failure)</li>
 *   <li>Payload JSON mapping and validation ({@link ErrorKind#PAYLOAD} wrapping the cause)</li>
 *   <li>Signature JSON mapping ({@link ErrorKind#SIGNATURE} wrapping the cause)</li>
 * </ol>
 *
 * <p>The payload section text is kept verbatim on the returned record.</p>
 */
public final class DefaultOcmfDecoder implements OcmfDecoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultOcmfDecoder.class);

    private final PayloadValidator validator;
    private final OcmfObservabilitySink sink;

    public DefaultOcmfDecoder() {
        this(OcmfValidationConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultOcmfDecoder(OcmfValidationConfig config, OcmfObservabilitySink sink) {
        this.validator = new PayloadValidator(Objects.requireNonNull(config, "config"));
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public OcmfResult<Ocmf> decode(String text)
    {
        Objects.requireNonNull(text, "text");
        try {
            // 1) Hex detection
            final OcmfFraming.Unwrapped unwrapped = OcmfFraming.unwrap(text);
            if (unwrapped.hexEncoded()) {
                log.debug("Input is hex-encoded; decoded {} characters", unwrapped.text().length());
            }

            // 2) Sections
            final String[] parts = OcmfFraming.split(unwrapped.text());
            final String payloadJson = parts[1];
            final String signatureJson = parts[2];
            log.debug("Split OCMF record: payload {} chars, signature {} chars",
                    payloadJson.length(), signatureJson.length());

            // 3) Payload
            final Payload payload = decodePayload(payloadJson);

            // 4) Signature
            final Signature signature = decodeSignature(signatureJson);

            final Ocmf record = new Ocmf(payload, signature, payloadJson);
            sink.onParsed(new OcmfParsedEvent(Instant.now(),
                    payload.pagination().toString(),
                    payload.serialNumber().orElse(null),
                    payload.readings().size(),
                    unwrapped.hexEncoded()));
            return OcmfResult.success(record);
        }
        catch (WireFormatException e) {
            sink.onError(new OcmfErrorEvent(Instant.now(), "parse", e.error()));
            return OcmfResult.failure(e.error());
        }
    }

    private Payload decodePayload(String json) throws WireFormatException
    {
        final JsonNode tree = readTree(json, ErrorKind.PAYLOAD, "Invalid payload JSON");
        final Payload mapped;
        try {
            mapped = PayloadMapper.map(tree);
        }
        catch (WireFormatException e) {
            throw new WireFormatException(e.error().wrap(ErrorKind.PAYLOAD, "Invalid payload"));
        }

        OcmfResult<Payload> validated = validator.validate(mapped);
        if (validated.error().isPresent()) {
            throw new WireFormatException(validated.error().get().wrap(ErrorKind.PAYLOAD, "Invalid payload"));
        }
        return mapped;
    }

    private static Signature decodeSignature(String json) throws WireFormatException
    {
        final JsonNode tree = readTree(json, ErrorKind.SIGNATURE, "Invalid signature JSON");
        try {
            return SignatureMapper.map(tree);
        }
        catch (WireFormatException e) {
            throw new WireFormatException(e.error().wrap(ErrorKind.SIGNATURE, "Invalid signature"));
        }
    }

    private static JsonNode readTree(String json, ErrorKind kind, String prefix) throws WireFormatException
    {
        try {
            final JsonNode tree = OcmfJson.MAPPER.readTree(json);
            if (tree == null || tree.isMissingNode()) {
                throw new WireFormatException(OcmfError.of(kind, prefix + ": section is empty"));
            }
            return tree;
        }
        catch (JsonProcessingException e) {
            throw new WireFormatException(OcmfError.of(kind, prefix + ": " + e.getOriginalMessage(), e));
        }
    }
}
