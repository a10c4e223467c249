package com.questrail.ocmf.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Signature section of an OCMF record.
 *
 * <p>{@code SA} is kept as the wire text so that an algorithm this library does
 * not know still parses; {@link #method()} resolves it when a verification is
 * attempted.</p>
 *
 * <p>Keys outside {@code SA SE SM SD PK KT} are kept in {@link #extensions()}
 * in their original order.</p>
 *
 * @param algorithm {@code SA}
 * @param encoding  {@code SE}
 * @param mimeType  {@code SM}, informational
 * @param data      {@code SD}, encoded per {@code encoding}
 * @param publicKey {@code PK}, embedded key or {@code null}
 * @param keyType   {@code KT}, key type such as {@code ECDSA-secp256r1}, or {@code null}
 * @param extensions unknown signature keys as opaque JSON
 */
public record Signature(
        String algorithm,
        SignatureEncoding encoding,
        String mimeType,
        String data,
        String publicKey,
        String keyType,
        Map<String, JsonNode> extensions
)
{
    public static final String DEFAULT_ALGORITHM = SignatureMethod.DEFAULT.toString();
    public static final String DEFAULT_MIME_TYPE = "application/x-der";

    public Signature {
        Objects.requireNonNull(data, "data");
        if (algorithm == null) {
            algorithm = DEFAULT_ALGORITHM;
        }
        if (encoding == null) {
            encoding = SignatureEncoding.HEX;
        }
        if (mimeType == null) {
            mimeType = DEFAULT_MIME_TYPE;
        }
        extensions = extensions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * Signature over hex data with every other field at its default.
     */
    public static Signature ofHex(String data) {
        return new Signature(null, null, null, data, null, null, null);
    }

    public Optional<SignatureMethod> method() {
        return SignatureMethod.parse(algorithm);
    }

    public Optional<String> embeddedPublicKey() {
        return Optional.ofNullable(publicKey);
    }

    public Optional<String> declaredKeyType() {
        return Optional.ofNullable(keyType);
    }
}
