package com.questrail.ocmf.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Signature algorithm ({@code SA}): {@code ECDSA-<curve>-<hash>}.
 *
 * @param curve named curve
 * @param hash  digest applied to the payload bytes
 */
public record SignatureMethod(CurveType curve, HashAlgorithm hash)
{
    public static final String PREFIX = "ECDSA-";

    public static final SignatureMethod DEFAULT =
            new SignatureMethod(CurveType.SECP256R1, HashAlgorithm.SHA256);

    public SignatureMethod {
        Objects.requireNonNull(curve, "curve");
        Objects.requireNonNull(hash, "hash");
    }

    /**
     * Resolves an {@code SA} value.
     *
     * @return empty if the prefix, curve or hash is not one OCMF defines
     */
    public static Optional<SignatureMethod> parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String rest = text.substring(PREFIX.length());
        int dash = rest.lastIndexOf('-');
        if (dash <= 0) {
            return Optional.empty();
        }
        Optional<CurveType> curve = CurveType.fromOcmfName(rest.substring(0, dash));
        Optional<HashAlgorithm> hash = HashAlgorithm.fromCode(rest.substring(dash + 1));
        if (curve.isEmpty() || hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SignatureMethod(curve.get(), hash.get()));
    }

    @Override
    public String toString() {
        return PREFIX + curve.ocmfName() + "-" + hash.name();
    }
}
