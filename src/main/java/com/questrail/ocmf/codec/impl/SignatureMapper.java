package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.model.Signature;
import com.questrail.ocmf.model.SignatureEncoding;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.questrail.ocmf.codec.impl.JsonFields.invalid;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalCode;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalString;
import static com.questrail.ocmf.codec.impl.JsonFields.requiredString;

/**
 * Maps the signature JSON object onto {@link Signature}.
 *
 * <p>{@code SD} must already be hex or base64 text here; whether it matches
 * {@code SE} is only decided when a verification is attempted. {@code SA} is
 * accepted as any string for the same reason.</p>
 */
final class SignatureMapper
{
    static final Set<String> FIELDS = Set.of("SA", "SE", "SM", "SD", "PK", "KT");

    private SignatureMapper() {}

    static Signature map(JsonNode root) throws WireFormatException {
        if (!root.isObject()) {
            throw invalid("signature", "must be a JSON object");
        }
        String data = requiredString(root, "SD");
        if (!TextEncodings.isHex(data) && !TextEncodings.isBase64(data)) {
            throw invalid("SD", "must be hex or base64 encoded");
        }
        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!FIELDS.contains(field.getKey())) {
                extensions.put(field.getKey(), field.getValue());
            }
        }
        return new Signature(
                optionalString(root, "SA").orElse(null),
                optionalCode(root, "SE", SignatureEncoding::fromCode, "hex, base64").orElse(null),
                optionalString(root, "SM").orElse(null),
                data,
                optionalString(root, "PK").orElse(null),
                optionalString(root, "KT").orElse(null),
                extensions);
    }
}
