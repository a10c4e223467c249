package com.questrail.ocmf.error;

/**
 * Classification of every failure an OCMF parse, validation or verification
 * can report.
 *
 * <p>A completed-but-failed signature verification is <strong>not</strong> an
 * error; it is a {@code false} result. {@link #VERIFICATION} is reserved for
 * verification that could not be attempted at all.</p>
 */
public enum ErrorKind
{
    /** Input is not of the shape {@code OCMF|<payload>|<signature>}. */
    FORMAT,

    /** Hex decoding failed (whole-record hex, hex signature data, hex key). */
    HEX_ENCODING,

    /** Base64 decoding failed (base64 signature data or key). */
    BASE64_ENCODING,

    /** The payload section could not be read or failed validation. */
    PAYLOAD,

    /** The signature section could not be read or failed validation. */
    SIGNATURE,

    /** A field or cross-field invariant was violated. */
    VALIDATION,

    /** Key material is unparseable or not an elliptic-curve key. */
    PUBLIC_KEY,

    /** Algorithm or curve unsupported or mismatched; verification not attempted. */
    VERIFICATION;

    /**
     * Returns {@code true} for the two encoding subtypes.
     */
    public boolean isEncoding() {
        return this == HEX_ENCODING || this == BASE64_ENCODING;
    }
}
