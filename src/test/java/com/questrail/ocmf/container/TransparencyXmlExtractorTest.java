package com.questrail.ocmf.container;

import com.questrail.ocmf.OcmfFixtures;
import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TransparencyXmlExtractorTest
{
    private final TransparencyXmlExtractor extractor = new TransparencyXmlExtractor();

    private static String xmlEscape(String s)
    {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
    }

    @Test
    void extractsSignedDataWithKey()
    {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<values>\n"
                + "  <value transactionId=\"1\" context=\"Transaction.Begin\">\n"
                + "    <signedData format=\"OCMF\" encoding=\"plain\">\n" + xmlEscape(OcmfFixtures.KEBA_RECORD) + "\n    </signedData>\n"
                + "    <publicKey encoding=\"hex\">" + OcmfFixtures.KEBA_PUBLIC_KEY + "</publicKey>\n"
                + "  </value>\n</values>";

        List<OcmfCandidate> candidates = extractor.extract(xml).orElseThrow();
        assertEquals(1, candidates.size());
        assertEquals(OcmfFixtures.KEBA_RECORD, candidates.get(0).ocmf());
        assertEquals(OcmfFixtures.KEBA_PUBLIC_KEY, candidates.get(0).publicKeyIfPresent().orElseThrow());
    }

    @Test
    void decodesHexEncodedData()
    {
        String hex = TextEncodings.encodeHex(OcmfFixtures.KEBA_RECORD.getBytes(StandardCharsets.UTF_8));
        String xml = "<values><value><encodedData format=\"OCMF\" encoding=\"HEX\">" + hex + "</encodedData></value></values>";

        List<OcmfCandidate> candidates = extractor.extract(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8))).orElseThrow();
        assertEquals(1, candidates.size());
        assertEquals(OcmfFixtures.KEBA_RECORD, candidates.get(0).ocmf());
        assertTrue(candidates.get(0).publicKeyIfPresent().isEmpty());
    }

    @Test
    void picksUpUnlabelledSignedDataOnceAndInOrder()
    {
        String first = OcmfFixtures.record("{\"PG\":\"T1\"}");
        String second = OcmfFixtures.record("{\"PG\":\"T2\"}");
        String xml = "<values>"
                + "<value><signedData>" + xmlEscape(second) + "</signedData></value>"
                + "<value><signedData format=\"OCMF\">" + xmlEscape(first) + "</signedData></value>"
                + "<value><signedData format=\"OCMF\">" + xmlEscape(first) + "</signedData></value>"
                + "<value><signedData format=\"EDL\">not ocmf</signedData></value>"
                + "</values>";

        List<OcmfCandidate> candidates = extractor.extract(xml).orElseThrow();
        assertEquals(List.of(first, second), candidates.stream().map(OcmfCandidate::ocmf).toList());
    }

    @Test
    void skipsUndecodableHex()
    {
        String xml = "<values><value><encodedData format=\"OCMF\" encoding=\"hex\">zz</encodedData></value></values>";
        assertTrue(extractor.extract(xml).orElseThrow().isEmpty());
    }

    @Test
    void malformedXmlIsAFormatError()
    {
        assertEquals(ErrorKind.FORMAT, extractor.extract("<values><value>").error().orElseThrow().kind());
    }

    @Test
    void rootMustBeValues()
    {
        assertEquals(ErrorKind.FORMAT, extractor.extract("<data/>").error().orElseThrow().kind());
    }

    @Test
    void doctypeIsRefused()
    {
        String xml = "<!DOCTYPE values [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><values>&x;</values>";
        assertEquals(ErrorKind.FORMAT, extractor.extract(xml).error().orElseThrow().kind());
    }
}
