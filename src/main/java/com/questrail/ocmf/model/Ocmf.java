package com.questrail.ocmf.model;

import com.questrail.ocmf.validation.PayloadValidator;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * A complete OCMF record: {@code OCMF|<payload>|<signature>}.
 *
 * <p>A record produced by the decoder also keeps the payload section exactly
 * as it appeared on the wire. The signature was computed over those bytes,
 * so verification must use them and never a re-serialization of
 * {@link #payload()}.</p>
 *
 * <p>The canonical constructor checks nothing beyond non-null sections; the
 * decoder uses it after validating. Records assembled in code should come
 * from {@link #of(Payload, Signature)}.</p>
 *
 * @param payload         decoded payload
 * @param signature       decoded signature
 * @param originalPayload payload JSON text as received, or {@code null} for
 *                        records assembled in code
 */
public record Ocmf(Payload payload, Signature signature, String originalPayload)
{
    public static final String HEADER = "OCMF";
    public static final char SEPARATOR = '|';

    public Ocmf {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(signature, "signature");
    }

    /**
     * Record assembled in code, with its payload checked under the default
     * validation rules.
     *
     * @throws com.questrail.ocmf.error.OcmfException with kind VALIDATION if
     *         the payload violates an invariant
     */
    public static Ocmf of(Payload payload, Signature signature) {
        return new Ocmf(PayloadValidator.defaults().validate(payload).orElseThrow(), signature, null);
    }

    public String header() {
        return HEADER;
    }

    /**
     * UTF-8 bytes of the payload as received, if this record was decoded.
     */
    public Optional<byte[]> originalPayloadBytes() {
        return Optional.ofNullable(originalPayload).map(s -> s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Same payload and signature, without the original wire text.
     */
    public Ocmf detached() {
        return new Ocmf(payload, signature, null);
    }
}
