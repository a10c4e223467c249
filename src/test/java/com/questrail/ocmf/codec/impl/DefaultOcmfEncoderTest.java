package com.questrail.ocmf.codec.impl;

import com.questrail.ocmf.OcmfFixtures;
import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.model.Signature;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultOcmfEncoderTest
{
    private final DefaultOcmfEncoder encoder = new DefaultOcmfEncoder();
    private final DefaultOcmfDecoder decoder = new DefaultOcmfDecoder();

    @Test
    void writesFieldsInProtocolOrder()
    {
        Ocmf record = new Ocmf(OcmfFixtures.beginPayload().build(), Signature.ofHex("3006020101020101"), null);

        String expected = "OCMF|"
                + "{\"FV\":\"1.0\",\"GS\":\"GW-001\",\"PG\":\"T1\",\"MS\":\"MTR-001\",\"IS\":false,\"IF\":[],\"IT\":\"NONE\","
                + "\"RD\":[{\"TM\":\"2024-03-01T10:00:00,000+0100 S\",\"TX\":\"B\",\"RV\":100.000,"
                + "\"RI\":\"01-00:B2.08.00*FF\",\"RU\":\"kWh\",\"ST\":\"G\"}]}"
                + "|{\"SA\":\"ECDSA-secp256r1-SHA256\",\"SE\":\"hex\",\"SM\":\"application/x-der\",\"SD\":\"3006020101020101\"}";

        assertEquals(expected, encoder.encode(record));
    }

    @Test
    void decodedRecordSurvivesReEncoding()
    {
        Ocmf original = decoder.decode(OcmfFixtures.KEBA_RECORD).orElseThrow();
        Ocmf again = decoder.decode(encoder.encode(original)).orElseThrow();

        assertEquals(original.payload(), again.payload());
        assertEquals(original.signature(), again.signature());
    }

    @Test
    void exponentDecimalsSurviveReEncoding()
    {
        String json = "{\"GS\":\"GW-1\",\"PG\":\"T1\",\"IS\":false,\"RD\":["
                + "{\"TM\":\"2024-03-01T10:00:00,000+0100 S\",\"TX\":\"B\",\"RV\":1E3,\"RI\":\"01-00:B2.08.00*FF\",\"RU\":\"kWh\",\"CL\":0,\"ST\":\"G\"},"
                + "{\"TX\":\"E\",\"RV\":1.5E3,\"CL\":2E1}]}";
        Ocmf original = decoder.decode(OcmfFixtures.record(json)).orElseThrow();
        String encoded = encoder.encode(original);
        Ocmf again = decoder.decode(encoded).orElseThrow();

        assertEquals(new BigDecimal("1000"), original.payload().readings().get(0).value());
        assertEquals(new BigDecimal("20"), original.payload().readings().get(1).cumulatedLoss());
        assertTrue(encoded.contains("\"RV\":1000,"));
        assertEquals(original.payload(), again.payload());
    }

    @Test
    void hexOutputIsLowerCaseUtf8()
    {
        Ocmf original = decoder.decode(OcmfFixtures.KEBA_RECORD).orElseThrow();
        String hex = encoder.encode(original, true);

        assertEquals(hex.toLowerCase(), hex);
        String text = new String(TextEncodings.decodeHex(hex), StandardCharsets.UTF_8);
        assertEquals(encoder.encode(original, false), text);
        assertEquals(original.payload(), decoder.decode(hex).orElseThrow().payload());
    }

    @Test
    void extensionsAreWrittenAfterReadings()
    {
        String json = "{\"GS\":\"GW-1\",\"PG\":\"T1\",\"IS\":false,\"RD\":[],\"XV\":{\"vendor\":\"acme\"}}";
        Ocmf record = decoder.decode(OcmfFixtures.record(json)).orElseThrow();

        assertTrue(encoder.encode(record).contains("\"RD\":[],\"XV\":{\"vendor\":\"acme\"}}"));
    }

    @Test
    void signatureKeyTypeAndUnknownKeysAreKept()
    {
        String text = "OCMF|{\"GS\":\"GW-1\",\"PG\":\"T1\",\"IS\":false,\"RD\":[]}"
                + "|{\"SA\":\"ECDSA-secp256r1-SHA256\",\"SD\":\"3006020101020101\",\"KT\":\"ECDSA-secp256r1\",\"XS\":{\"slot\":2}}";
        Ocmf record = decoder.decode(text).orElseThrow();

        assertEquals("ECDSA-secp256r1", record.signature().keyType());
        assertEquals(2, record.signature().extensions().get("XS").get("slot").intValue());

        String encoded = encoder.encode(record);
        assertTrue(encoded.endsWith("\"SD\":\"3006020101020101\",\"KT\":\"ECDSA-secp256r1\",\"XS\":{\"slot\":2}}"));
        assertEquals(record.signature(), decoder.decode(encoded).orElseThrow().signature());
    }
}
