package com.questrail.ocmf.model;

import com.questrail.ocmf.OcmfFixtures;
import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OcmfTest
{
    private static final Signature SIGNATURE = Signature.ofHex("3006020101020101");

    @Test
    void factoryAcceptsValidPayload()
    {
        Payload payload = OcmfFixtures.beginPayload().buildUnvalidated();
        Ocmf record = Ocmf.of(payload, SIGNATURE);

        assertSame(payload, record.payload());
        assertTrue(record.originalPayloadBytes().isEmpty());
    }

    @Test
    void factoryRejectsPayloadBreakingFieldInvariants()
    {
        Payload payload = OcmfFixtures.beginPayload()
                .withIdentificationType(IdentificationType.ISO14443)
                .withIdentificationData("1F2E3D")
                .buildUnvalidated();

        OcmfException e = assertThrows(OcmfException.class, () -> Ocmf.of(payload, SIGNATURE));
        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertEquals("ID", e.error().field());
    }
}
