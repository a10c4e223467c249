package com.questrail.ocmf.crypto;

import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.CurveType;
import com.questrail.ocmf.model.SignatureMethod;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X962Parameters;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECPoint;

import java.io.IOException;
import java.util.Objects;

/**
 * PublicKeyInfo
 * -----------------------------------------------------------------------------
 * A decoded elliptic-curve public key with the metadata OCMF verification needs.
 *
 * <h2>Accepted input</h2>
 * <ol>
 *   <li>hex text, otherwise base64 text</li>
 *   <li>the decoded bytes as a DER {@code SubjectPublicKeyInfo} with a named curve</li>
 *   <li>if that fails and there are exactly 64 bytes, raw {@code X || Y}
 *       coordinates on secp256r1</li>
 * </ol>
 *
 * <p>{@link #toHex()} and {@link #toBase64()} always render the DER form, also
 * for keys supplied as raw coordinates.</p>
 */
public final class PublicKeyInfo
{
    private static final int RAW_P256_LENGTH = 64;

    private final CurveType curve;
    private final byte[] encoded;
    private final ECPublicKeyParameters parameters;

    private PublicKeyInfo(CurveType curve, byte[] encoded, ECPublicKeyParameters parameters) {
        this.curve = curve;
        this.encoded = encoded;
        this.parameters = parameters;
    }

    /**
     * Decodes a hex or base64 key.
     *
     * @return the key, or an error of kind BASE64_ENCODING (neither hex nor
     *         base64) or PUBLIC_KEY (not a usable EC key)
     */
    public static OcmfResult<PublicKeyInfo> parse(String text) {
        Objects.requireNonNull(text, "text");
        final String trimmed = text.strip();

        if (TextEncodings.isHex(trimmed) && !trimmed.isEmpty()) {
            return fromBytes(TextEncodings.decodeHex(trimmed));
        }
        if (TextEncodings.isBase64(trimmed) && !trimmed.isEmpty()) {
            return fromBytes(TextEncodings.decodeBase64(trimmed));
        }
        return OcmfResult.failure(OcmfError.of(ErrorKind.BASE64_ENCODING,
                "Invalid public key encoding: not valid hex or base64"));
    }

    /**
     * Decodes DER or raw P-256 key bytes.
     */
    public static OcmfResult<PublicKeyInfo> fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        try {
            return OcmfResult.success(fromDer(bytes));
        }
        catch (KeyFormatException e) {
            if (bytes.length == RAW_P256_LENGTH) {
                try {
                    return OcmfResult.success(fromRawP256(bytes));
                }
                catch (KeyFormatException rawFailure) {
                    e.addSuppressed(rawFailure);
                }
            }
            return OcmfResult.failure(OcmfError.of(ErrorKind.PUBLIC_KEY,
                    "Failed to parse public key: " + e.getMessage(), e));
        }
    }

    private static PublicKeyInfo fromDer(byte[] der) throws KeyFormatException {
        final SubjectPublicKeyInfo spki;
        try {
            spki = SubjectPublicKeyInfo.getInstance(der);
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            throw new KeyFormatException("not a DER SubjectPublicKeyInfo", e);
        }
        if (spki == null) {
            throw new KeyFormatException("empty key", null);
        }

        AlgorithmIdentifier algorithm = spki.getAlgorithm();
        if (!X9ObjectIdentifiers.id_ecPublicKey.equals(algorithm.getAlgorithm())) {
            throw new KeyFormatException("Public key is not an elliptic curve key (algorithm "
                    + algorithm.getAlgorithm().getId() + ")", null);
        }

        final X962Parameters x962;
        try {
            x962 = X962Parameters.getInstance(algorithm.getParameters());
        }
        catch (IllegalArgumentException e) {
            throw new KeyFormatException("malformed EC parameters", e);
        }
        if (x962 == null || !x962.isNamedCurve()) {
            throw new KeyFormatException("EC key does not name its curve", null);
        }

        ASN1ObjectIdentifier oid = ASN1ObjectIdentifier.getInstance(x962.getParameters());
        CurveType curve = CurveTable.fromOid(oid)
                .orElseThrow(() -> new KeyFormatException("Unsupported elliptic curve in public key: " + oid.getId(), null));

        final byte[] encodedPoint;
        try {
            encodedPoint = spki.getPublicKeyData().getOctets();
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            throw new KeyFormatException("malformed public key BIT STRING", e);
        }
        ECPoint point = decodePoint(curve, encodedPoint);
        return new PublicKeyInfo(curve, der.clone(),
                new ECPublicKeyParameters(point, CurveTable.domain(curve)));
    }

    private static PublicKeyInfo fromRawP256(byte[] raw) throws KeyFormatException {
        byte[] uncompressed = new byte[raw.length + 1];
        uncompressed[0] = 0x04;
        System.arraycopy(raw, 0, uncompressed, 1, raw.length);

        ECPoint point = decodePoint(CurveType.SECP256R1, uncompressed);
        SubjectPublicKeyInfo spki = new SubjectPublicKeyInfo(
                new AlgorithmIdentifier(X9ObjectIdentifiers.id_ecPublicKey, CurveTable.oid(CurveType.SECP256R1)),
                point.getEncoded(false));
        try {
            return new PublicKeyInfo(CurveType.SECP256R1, spki.getEncoded(ASN1Encoding.DER),
                    new ECPublicKeyParameters(point, CurveTable.domain(CurveType.SECP256R1)));
        }
        catch (IOException e) {
            throw new KeyFormatException("unable to encode raw P-256 key", e);
        }
    }

    private static ECPoint decodePoint(CurveType curve, byte[] encodedPoint) throws KeyFormatException {
        ECDomainParameters domain = CurveTable.domain(curve);
        try {
            ECPoint point = domain.getCurve().decodePoint(encodedPoint);
            if (!point.isValid() || point.isInfinity()) {
                throw new KeyFormatException("point is not on curve " + curve.standardName(), null);
            }
            return point;
        }
        catch (IllegalArgumentException e) {
            throw new KeyFormatException("invalid point for curve " + curve.standardName(), e);
        }
    }

    public CurveType curve() {
        return curve;
    }

    public int keySizeBits() {
        return CurveTable.keySizeBits(curve);
    }

    public int blockLengthBytes() {
        return keySizeBits() / 8;
    }

    /**
     * Key type as it appears in signature algorithm names, e.g. {@code ECDSA-secp256r1}.
     */
    public String keyTypeIdentifier() {
        return SignatureMethod.PREFIX + curve.ocmfName();
    }

    /**
     * {@code true} if the key is on the curve the signature method names.
     */
    public boolean matchesSignatureMethod(SignatureMethod method) {
        return method != null && curve.sameCurveAs(method.curve());
    }

    public byte[] encoded() {
        return encoded.clone();
    }

    public String toHex() {
        return TextEncodings.encodeHex(encoded);
    }

    public String toBase64() {
        return TextEncodings.encodeBase64(encoded);
    }

    ECPublicKeyParameters parameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "PublicKeyInfo[" + curve.standardName() + ", " + keySizeBits() + " bit]";
    }

    /**
     * Internal failure while decoding key material.
     */
    private static final class KeyFormatException extends Exception
    {
        KeyFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
