package com.questrail.ocmf.codec.impl;

import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.model.Ocmf;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * OcmfFraming
 * -----------------------------------------------------------------------------
 * Outer framing of an OCMF string.
 *
 * <ul>
 *   <li>{@link #unwrap(String)} trims the input and, if it does not start with
 *       {@code "OCMF|"}, decodes it as hex-encoded UTF-8.</li>
 *   <li>{@link #split(String)} splits on {@code '|'} into at most three parts
 *       and requires exactly three with the literal {@code "OCMF"} first.</li>
 * </ul>
 *
 * Neither step looks inside the JSON sections.
 */
final class OcmfFraming
{
    static final String PREFIX = Ocmf.HEADER + Ocmf.SEPARATOR;

    private OcmfFraming() {}

    /**
     * Result of {@link #unwrap(String)}.
     *
     * @param text       plain OCMF text
     * @param hexEncoded whether the input was hex-encoded
     */
    record Unwrapped(String text, boolean hexEncoded) {}

    /**
     * @throws WireFormatException with kind HEX_ENCODING if the input is neither
     *         plain OCMF nor hex-encoded UTF-8
     */
    static Unwrapped unwrap(String input) throws WireFormatException
    {
        final String trimmed = input.strip();
        if (trimmed.startsWith(PREFIX)) {
            return new Unwrapped(trimmed, false);
        }

        final byte[] bytes;
        try {
            bytes = TextEncodings.decodeHex(trimmed);
        }
        catch (IllegalArgumentException e) {
            throw new WireFormatException(OcmfError.of(ErrorKind.HEX_ENCODING,
                    "Invalid OCMF string: must start with '" + PREFIX + "' or be valid hex-encoded. "
                            + e.getMessage(), e));
        }

        try {
            String decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new Unwrapped(decoded, true);
        }
        catch (CharacterCodingException e) {
            throw new WireFormatException(OcmfError.of(ErrorKind.HEX_ENCODING,
                    "Hex-encoded OCMF string is not valid UTF-8", e));
        }
    }

    /**
     * @return {@code [header, payload, signature]}
     * @throws WireFormatException with kind FORMAT if the text is not three
     *         {@code '|'}-separated parts headed by {@code "OCMF"}
     */
    static String[] split(String text) throws WireFormatException
    {
        final String[] parts = text.split("\\|", 3);
        if (parts.length != 3 || !Ocmf.HEADER.equals(parts[0])) {
            throw new WireFormatException(OcmfError.of(ErrorKind.FORMAT,
                    "String does not match expected OCMF format 'OCMF|{payload}|{signature}' (found "
                            + parts.length + " part(s)" + (parts.length > 0 ? ", header '" + abbreviate(parts[0]) + "'" : "")
                            + ")"));
        }
        return parts;
    }

    private static String abbreviate(String s) {
        return s.length() <= 16 ? s : s.substring(0, 16) + "...";
    }
}
