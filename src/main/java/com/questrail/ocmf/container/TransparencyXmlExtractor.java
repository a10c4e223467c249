package com.questrail.ocmf.container;

import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * TransparencyXmlExtractor
 * -----------------------------------------------------------------------------
 * Pulls OCMF strings out of the XML documents exchanged with transparency
 * software.
 *
 * <h2>Document shape</h2>
 * <pre>
 * &lt;values&gt;
 *   &lt;value transactionId="..." context="..."&gt;
 *     &lt;signedData format="OCMF"&gt;OCMF|...|...&lt;/signedData&gt;
 *     &lt;encodedData format="OCMF" encoding="hex"&gt;4f434d467c...&lt;/encodedData&gt;
 *     &lt;publicKey encoding="hex"&gt;3059...&lt;/publicKey&gt;
 *   &lt;/value&gt;
 * &lt;/values&gt;
 * </pre>
 *
 * <h2>Candidate order</h2>
 * <ol>
 *   <li>every {@code signedData} with {@code format="OCMF"}</li>
 *   <li>every hex {@code encodedData} with {@code format="OCMF"} that decodes
 *       to text starting with {@code OCMF|}</li>
 *   <li>any other {@code signedData} whose text starts with {@code OCMF|}</li>
 * </ol>
 * Duplicate strings are reported once. Each candidate carries the
 * {@code publicKey} of the {@code value} it came from.
 *
 * <p>This class does not parse the OCMF strings; pass them to a decoder.</p>
 */
public final class TransparencyXmlExtractor
{
    private static final Logger log = LoggerFactory.getLogger(TransparencyXmlExtractor.class);

    private static final String ROOT = "values";
    private static final String VALUE = "value";
    private static final String SIGNED_DATA = "signedData";
    private static final String ENCODED_DATA = "encodedData";
    private static final String PUBLIC_KEY = "publicKey";
    private static final String OCMF_FORMAT = "OCMF";
    private static final String OCMF_PREFIX = "OCMF|";

    public OcmfResult<List<OcmfCandidate>> extract(String xml) {
        Objects.requireNonNull(xml, "xml");
        return extract(new InputSource(new StringReader(xml)));
    }

    public OcmfResult<List<OcmfCandidate>> extract(InputStream in) {
        Objects.requireNonNull(in, "in");
        return extract(new InputSource(in));
    }

    private OcmfResult<List<OcmfCandidate>> extract(InputSource source) {
        final Document document;
        try {
            document = newBuilder().parse(source);
        }
        catch (SAXException | IOException e) {
            return OcmfResult.failure(OcmfError.of(ErrorKind.FORMAT,
                    "Failed to parse XML file: " + e.getMessage(), e));
        }
        catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }

        Element root = document.getDocumentElement();
        if (!ROOT.equals(root.getTagName())) {
            return OcmfResult.failure(OcmfError.of(ErrorKind.FORMAT,
                    "Root element must be <values>, got <" + root.getTagName() + ">"));
        }

        List<Element> values = children(root, VALUE);
        Map<String, OcmfCandidate> found = new LinkedHashMap<>();

        for (Element value : values) {
            Element signed = firstChild(value, SIGNED_DATA);
            if (signed != null && OCMF_FORMAT.equals(signed.getAttribute("format"))) {
                add(found, signed.getTextContent(), value);
            }
        }

        for (Element value : values) {
            Element encoded = firstChild(value, ENCODED_DATA);
            if (encoded == null || !OCMF_FORMAT.equals(encoded.getAttribute("format"))) {
                continue;
            }
            if (!"hex".equals(encoded.getAttribute("encoding").toLowerCase(Locale.ROOT))) {
                continue;
            }
            String decoded = decodeHexText(encoded.getTextContent().strip());
            if (decoded != null && decoded.strip().startsWith(OCMF_PREFIX)) {
                add(found, decoded, value);
            }
        }

        for (Element value : values) {
            Element signed = firstChild(value, SIGNED_DATA);
            if (signed != null && signed.getTextContent().strip().startsWith(OCMF_PREFIX)) {
                add(found, signed.getTextContent(), value);
            }
        }

        log.debug("Extracted {} OCMF candidate(s) from {} <value> element(s)", found.size(), values.size());
        return OcmfResult.success(Collections.unmodifiableList(new ArrayList<>(found.values())));
    }

    private static void add(Map<String, OcmfCandidate> found, String text, Element value) {
        String ocmf = text.strip();
        if (ocmf.isEmpty() || found.containsKey(ocmf)) {
            return;
        }
        Element key = firstChild(value, PUBLIC_KEY);
        String publicKey = key == null ? null : key.getTextContent().strip();
        found.put(ocmf, new OcmfCandidate(ocmf, publicKey == null || publicKey.isEmpty() ? null : publicKey));
    }

    /**
     * @return the UTF-8 text, or {@code null} if the content is not hex-encoded UTF-8
     */
    private static String decodeHexText(String hex) {
        if (hex.isEmpty() || !TextEncodings.isHex(hex)) {
            log.debug("Skipping <encodedData>: content is not hex");
            return null;
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(TextEncodings.decodeHex(hex)))
                    .toString();
        }
        catch (CharacterCodingException e) {
            log.debug("Skipping <encodedData>: content is not UTF-8", e);
            return null;
        }
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tag.equals(((Element) node).getTagName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Element firstChild(Element parent, String tag) {
        List<Element> matches = children(parent, tag);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory.newDocumentBuilder();
    }
}
