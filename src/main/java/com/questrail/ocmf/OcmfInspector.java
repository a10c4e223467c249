package com.questrail.ocmf;

import com.questrail.ocmf.codec.OcmfDecoder;
import com.questrail.ocmf.codec.OcmfEncoder;
import com.questrail.ocmf.codec.impl.DefaultOcmfDecoder;
import com.questrail.ocmf.codec.impl.DefaultOcmfEncoder;
import com.questrail.ocmf.compliance.EichrechtChecker;
import com.questrail.ocmf.compliance.EichrechtIssue;
import com.questrail.ocmf.compliance.EichrechtPolicy;
import com.questrail.ocmf.crypto.SignatureVerifier;
import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.observability.NullObservabilitySink;
import com.questrail.ocmf.observability.OcmfObservabilitySink;
import com.questrail.ocmf.validation.OcmfValidationConfig;

import java.util.List;
import java.util.Objects;

/**
 * OcmfInspector
 * =============================================================================
 * Single entry point for tools that read, verify and check OCMF records.
 *
 * <p>Wires a decoder, an encoder, a signature verifier and an Eichrecht
 * checker to one configuration and one observability sink. Instances are
 * immutable and safe to share between threads.</p>
 *
 * <pre>{@code
 * OcmfInspector inspector = OcmfInspector.builder()
 *         .withObservabilitySink(new Slf4jOcmfObservabilitySink())
 *         .build();
 *
 * Ocmf begin = inspector.parseOrThrow(beginText);
 * Ocmf end = inspector.parseOrThrow(endText);
 * VerificationReport report = inspector.verify(begin, publicKeyHex, end).orElseThrow();
 * }</pre>
 */
public final class OcmfInspector
{
    private final OcmfDecoder decoder;
    private final OcmfEncoder encoder;
    private final SignatureVerifier verifier;
    private final EichrechtChecker checker;

    private OcmfInspector(Builder b) {
        this.decoder = new DefaultOcmfDecoder(b.validationConfig, b.sink);
        this.encoder = new DefaultOcmfEncoder();
        this.verifier = new SignatureVerifier(b.sink);
        this.checker = new EichrechtChecker(b.policy, b.sink);
    }

    public static OcmfInspector defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Parse / serialize
    // ---------------------------------------------------------------------

    /**
     * Parses plain or hex-encoded OCMF text.
     */
    public OcmfResult<Ocmf> parse(String text) {
        return decoder.decode(text);
    }

    /**
     * @throws com.questrail.ocmf.error.OcmfException if the text is not a valid record
     */
    public Ocmf parseOrThrow(String text) {
        return parse(text).orElseThrow();
    }

    public String serialize(Ocmf record, boolean hex) {
        return encoder.encode(record, hex);
    }

    public String serialize(Ocmf record) {
        return serialize(record, false);
    }

    // ---------------------------------------------------------------------
    // Signature
    // ---------------------------------------------------------------------

    /**
     * Verifies the record's signature over its original payload text.
     *
     * @param publicKey hex or base64 key, or {@code null} to use the embedded {@code PK}
     */
    public OcmfResult<Boolean> verifySignature(Ocmf record, String publicKey) {
        return verifier.verify(record, publicKey);
    }

    /**
     * @throws com.questrail.ocmf.error.OcmfException if verification could not be attempted
     */
    public boolean verifySignatureOrThrow(Ocmf record, String publicKey) {
        return verifySignature(record, publicKey).orElseThrow();
    }

    // ---------------------------------------------------------------------
    // Compliance
    // ---------------------------------------------------------------------

    public List<EichrechtIssue> checkCompliance(Ocmf record) {
        return checker.checkCompliance(record, null, false);
    }

    /**
     * @param other end record of the transaction, or {@code null} for a single-record check
     */
    public List<EichrechtIssue> checkCompliance(Ocmf record, Ocmf other) {
        return checker.checkCompliance(record, other, false);
    }

    public List<EichrechtIssue> checkCompliance(Ocmf record, Ocmf other, boolean errorsOnly) {
        return checker.checkCompliance(record, other, errorsOnly);
    }

    public boolean isCompliant(Ocmf record) {
        return checker.isCompliant(record);
    }

    public boolean validateTransactionPair(Ocmf begin, Ocmf end) {
        return checker.validateTransactionPair(begin, end);
    }

    // ---------------------------------------------------------------------
    // Combined
    // ---------------------------------------------------------------------

    /**
     * Verifies the signature and checks compliance in one call.
     *
     * <p>Only {@code record}'s signature is verified. When {@code other} is
     * given the pair is checked as a transaction with {@code record} as the
     * begin record, as in {@link #checkCompliance(Ocmf, Ocmf)}.</p>
     *
     * @param publicKey hex or base64 key, or {@code null} to use the embedded {@code PK}
     * @param other     end record of the transaction, or {@code null}
     * @return the report, or the error that prevented signature verification
     */
    public OcmfResult<VerificationReport> verify(Ocmf record, String publicKey, Ocmf other) {
        Objects.requireNonNull(record, "record");
        return verifySignature(record, publicKey).map(valid ->
                new VerificationReport(valid, checker.checkCompliance(record, other, false)));
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private OcmfValidationConfig validationConfig = OcmfValidationConfig.defaults();
        private EichrechtPolicy policy = EichrechtPolicy.defaults();
        private OcmfObservabilitySink sink = NullObservabilitySink.INSTANCE;

        private Builder() {}

        public Builder withValidationConfig(OcmfValidationConfig validationConfig) {
            this.validationConfig = Objects.requireNonNull(validationConfig, "validationConfig");
            return this;
        }

        public Builder withEichrechtPolicy(EichrechtPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withObservabilitySink(OcmfObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public OcmfInspector build() {
            return new OcmfInspector(this);
        }
    }
}
