package com.questrail.ocmf.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SignatureMethodTest
{
    @Test
    void parsesKnownAlgorithms()
    {
        SignatureMethod m = SignatureMethod.parse("ECDSA-brainpool384r1-SHA256").orElseThrow();
        assertEquals(CurveType.BRAINPOOL384R1, m.curve());
        assertEquals(HashAlgorithm.SHA256, m.hash());
        assertEquals("ECDSA-brainpool384r1-SHA256", m.toString());

        assertEquals(HashAlgorithm.SHA512,
                SignatureMethod.parse("ECDSA-secp521r1-SHA512").orElseThrow().hash());
    }

    @Test
    void unknownAlgorithmsResolveToEmpty()
    {
        assertTrue(SignatureMethod.parse("RSA-2048-SHA256").isEmpty());
        assertTrue(SignatureMethod.parse("ECDSA-secp999r1-SHA256").isEmpty());
        assertTrue(SignatureMethod.parse("ECDSA-secp256r1-MD5").isEmpty());
        assertTrue(SignatureMethod.parse(null).isEmpty());
    }

    @Test
    void signatureDefaults()
    {
        Signature s = Signature.ofHex("3006020101020101");
        assertEquals("ECDSA-secp256r1-SHA256", s.algorithm());
        assertEquals(SignatureEncoding.HEX, s.encoding());
        assertEquals("application/x-der", s.mimeType());
        assertEquals(SignatureMethod.DEFAULT, s.method().orElseThrow());
        assertTrue(s.embeddedPublicKey().isEmpty());
    }
}
