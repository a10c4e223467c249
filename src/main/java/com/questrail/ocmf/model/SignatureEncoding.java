package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Encoding of the signature data ({@code SE}).
 */
public enum SignatureEncoding
{
    HEX("hex"),
    BASE64("base64");

    private final String code;

    SignatureEncoding(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<SignatureEncoding> fromCode(String code) {
        for (SignatureEncoding encoding : values()) {
            if (encoding.code.equals(code)) {
                return Optional.of(encoding);
            }
        }
        return Optional.empty();
    }
}
