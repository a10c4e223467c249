package com.questrail.ocmf.codec;

import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Hex and base64 helpers shared by the codec and the crypto layer.
 *
 * <p>Hex input is case-insensitive and must have an even number of digits.
 * Hex output is lower-case.</p>
 */
public final class TextEncodings
{
    private static final HexFormat HEX = HexFormat.of();
    private static final Pattern HEX_DIGITS = Pattern.compile("(?:[0-9A-Fa-f]{2})*");
    private static final Pattern BASE64_TEXT = Pattern.compile("[A-Za-z0-9+/]*={0,2}");

    private TextEncodings() {}

    public static boolean isHex(String text) {
        return text != null && HEX_DIGITS.matcher(text).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not an even run of hex digits
     */
    public static byte[] decodeHex(String text) {
        return HEX.parseHex(text);
    }

    public static String encodeHex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    public static boolean isBase64(String text) {
        if (text == null || text.length() % 4 != 0 || !BASE64_TEXT.matcher(text).matches()) {
            return false;
        }
        try {
            Base64.getDecoder().decode(text);
            return true;
        }
        catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not valid base64
     */
    public static byte[] decodeBase64(String text) {
        return Base64.getDecoder().decode(text);
    }

    public static String encodeBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
