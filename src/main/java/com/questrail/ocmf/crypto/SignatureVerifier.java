package com.questrail.ocmf.crypto;

import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.HashAlgorithm;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.model.Signature;
import com.questrail.ocmf.model.SignatureEncoding;
import com.questrail.ocmf.model.SignatureMethod;
import com.questrail.ocmf.observability.NullObservabilitySink;
import com.questrail.ocmf.observability.OcmfErrorEvent;
import com.questrail.ocmf.observability.OcmfObservabilitySink;
import com.questrail.ocmf.observability.OcmfVerificationEvent;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SignatureVerifier
 * -----------------------------------------------------------------------------
 * ECDSA verification of an OCMF signature over the payload bytes as received.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Resolve curve and hash from {@code SA} ({@code ECDSA-<curve>-<hash>})</li>
 *   <li>Decode {@code SD} per {@code SE}</li>
 *   <li>Decode the public key ({@link PublicKeyInfo#parse(String)})</li>
 *   <li>Require the key's curve to equal the algorithm's curve</li>
 *   <li>Hash the payload bytes and verify the DER {@code (r, s)} pair</li>
 * </ol>
 *
 * <h2>Outcome</h2>
 * <ul>
 *   <li>{@code true}/{@code false}: the verification ran. Signature bytes that
 *       are not a DER {@code (r, s)} sequence count as {@code false}.</li>
 *   <li>Failure: the verification could not be attempted (unsupported or
 *       mismatched algorithm, undecodable signature data or key, no original
 *       payload).</li>
 * </ul>
 *
 * <p>Stateless apart from the sink; safe to share between threads.</p>
 */
public final class SignatureVerifier
{
    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

    private final OcmfObservabilitySink sink;

    public SignatureVerifier() {
        this(NullObservabilitySink.INSTANCE);
    }

    public SignatureVerifier(OcmfObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Verifies a decoded record.
     *
     * @param publicKey hex or base64 key; if {@code null}, the signature's
     *                  embedded {@code PK} is used
     */
    public OcmfResult<Boolean> verify(Ocmf record, String publicKey) {
        Objects.requireNonNull(record, "record");

        Optional<byte[]> payload = record.originalPayloadBytes();
        if (payload.isEmpty()) {
            return fail(OcmfError.of(ErrorKind.VERIFICATION,
                    "Cannot verify signature: original payload JSON not available. "
                            + "Verification requires the exact payload bytes the record was decoded from."));
        }

        String key = publicKey != null ? publicKey : record.signature().publicKey();
        if (key == null) {
            return fail(OcmfError.of(ErrorKind.VERIFICATION,
                    "Cannot verify signature: no public key supplied and none embedded (PK)"));
        }
        return verify(payload.get(), record.signature(), key);
    }

    /**
     * Verifies {@code signature} over {@code originalPayload} with a hex or base64 key.
     */
    public OcmfResult<Boolean> verify(byte[] originalPayload, Signature signature, String publicKey) {
        Objects.requireNonNull(originalPayload, "originalPayload");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(publicKey, "publicKey");

        OcmfResult<Prepared> prepared = prepare(signature);
        if (prepared.error().isPresent()) {
            return fail(prepared.error().get());
        }
        OcmfResult<PublicKeyInfo> key = PublicKeyInfo.parse(publicKey);
        if (key.error().isPresent()) {
            return fail(key.error().get());
        }
        return complete(originalPayload, prepared.orElseThrow(), key.orElseThrow());
    }

    /**
     * Verifies {@code signature} over {@code originalPayload} with a decoded key.
     */
    public OcmfResult<Boolean> verify(byte[] originalPayload, Signature signature, PublicKeyInfo key) {
        Objects.requireNonNull(originalPayload, "originalPayload");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(key, "key");

        OcmfResult<Prepared> prepared = prepare(signature);
        if (prepared.error().isPresent()) {
            return fail(prepared.error().get());
        }
        return complete(originalPayload, prepared.orElseThrow(), key);
    }

    /**
     * Resolved algorithm and decoded signature bytes.
     */
    private record Prepared(SignatureMethod method, byte[] signatureBytes) {}

    private static OcmfResult<Prepared> prepare(Signature signature) {
        // 1) Algorithm
        Optional<SignatureMethod> method = signature.method();
        if (method.isEmpty()) {
            return OcmfResult.failure(OcmfError.of(ErrorKind.VERIFICATION,
                    "Unsupported signature algorithm (SA): " + signature.algorithm()));
        }

        // 2) Signature data
        try {
            byte[] bytes = switch (signature.encoding()) {
                case HEX -> TextEncodings.decodeHex(signature.data());
                case BASE64 -> TextEncodings.decodeBase64(signature.data());
            };
            return OcmfResult.success(new Prepared(method.get(), bytes));
        }
        catch (IllegalArgumentException e) {
            ErrorKind kind = signature.encoding() == SignatureEncoding.HEX
                    ? ErrorKind.HEX_ENCODING
                    : ErrorKind.BASE64_ENCODING;
            return OcmfResult.failure(OcmfError.of(kind,
                    "Failed to decode " + signature.encoding().code() + " signature data: " + e.getMessage(), e));
        }
    }

    private OcmfResult<Boolean> complete(byte[] originalPayload, Prepared prepared, PublicKeyInfo key) {
        SignatureMethod method = prepared.method();

        // 3) Curve agreement
        if (!key.matchesSignatureMethod(method)) {
            return fail(OcmfError.of(ErrorKind.VERIFICATION,
                    "Public key curve mismatch: key is on " + key.curve().standardName()
                            + " but signature algorithm " + method + " requires "
                            + method.curve().standardName()));
        }

        log.debug("Verifying {} over {} payload bytes with {} bit key",
                method, originalPayload.length, key.keySizeBits());

        // 4) ECDSA
        boolean valid = verifyDer(method.hash(), originalPayload, prepared.signatureBytes(), key);
        sink.onVerification(new OcmfVerificationEvent(Instant.now(),
                method.toString(), key.curve().standardName(), key.keySizeBits(), valid));
        return OcmfResult.success(valid);
    }

    private static boolean verifyDer(HashAlgorithm hash, byte[] payload, byte[] der, PublicKeyInfo key) {
        final BigInteger r;
        final BigInteger s;
        try {
            ASN1Sequence seq = ASN1Sequence.getInstance(der);
            if (seq.size() != 2) {
                log.debug("Signature DER sequence has {} elements, expected 2", seq.size());
                return false;
            }
            r = ASN1Integer.getInstance(seq.getObjectAt(0)).getValue();
            s = ASN1Integer.getInstance(seq.getObjectAt(1)).getValue();
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            log.debug("Signature bytes are not a DER (r, s) sequence: {}", e.getMessage());
            return false;
        }

        ECDSASigner signer = new ECDSASigner();
        signer.init(false, key.parameters());
        return signer.verifySignature(digest(hash, payload), r, s);
    }

    private static byte[] digest(HashAlgorithm hash, byte[] payload) {
        Digest digest = switch (hash) {
            case SHA256 -> new SHA256Digest();
            case SHA512 -> new SHA512Digest();
        };
        digest.update(payload, 0, payload.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private OcmfResult<Boolean> fail(OcmfError error) {
        sink.onError(new OcmfErrorEvent(Instant.now(), "verify", error));
        return OcmfResult.failure(error);
    }
}
