package com.questrail.ocmf.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TextEncodingsTest
{
    @Test
    void hexDetection()
    {
        assertTrue(TextEncodings.isHex("00ff"));
        assertTrue(TextEncodings.isHex("ABCDEF"));
        assertFalse(TextEncodings.isHex("abc"));
        assertFalse(TextEncodings.isHex("0g"));
    }

    @Test
    void hexIsWrittenLowerCase()
    {
        assertEquals("00ff10", TextEncodings.encodeHex(new byte[] { 0x00, (byte) 0xFF, 0x10 }));
        assertArrayEquals(new byte[] { 0x00, (byte) 0xFF }, TextEncodings.decodeHex("00FF"));
    }

    @Test
    void base64Detection()
    {
        assertTrue(TextEncodings.isBase64("TWFu"));
        assertTrue(TextEncodings.isBase64("TWE="));
        assertFalse(TextEncodings.isBase64("TWE"));
        assertFalse(TextEncodings.isBase64("TW!="));
        assertArrayEquals("Man".getBytes(), TextEncodings.decodeBase64("TWFu"));
    }
}
