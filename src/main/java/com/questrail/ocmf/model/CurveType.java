package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Elliptic curves an OCMF signature algorithm may name.
 *
 * <p>OCMF spells some curves two ways ({@code brainpool256r1} and
 * {@code brainpoolP256r1}); {@link #standardName()} maps both to the same
 * named curve, and curve equality is decided on that name.</p>
 */
public enum CurveType
{
    SECP192K1("secp192k1", "secp192k1"),
    SECP256K1("secp256k1", "secp256k1"),
    SECP192R1("secp192r1", "secp192r1"),
    SECP256R1("secp256r1", "secp256r1"),
    SECP384R1("secp384r1", "secp384r1"),
    SECP521R1("secp521r1", "secp521r1"),
    BRAINPOOL256R1("brainpool256r1", "brainpoolP256r1"),
    BRAINPOOLP256R1("brainpoolP256r1", "brainpoolP256r1"),
    BRAINPOOL384R1("brainpool384r1", "brainpoolP384r1");

    private final String ocmfName;
    private final String standardName;

    CurveType(String ocmfName, String standardName) {
        this.ocmfName = ocmfName;
        this.standardName = standardName;
    }

    /**
     * Spelling used inside {@code SA}.
     */
    public String ocmfName() {
        return ocmfName;
    }

    /**
     * SEC 2 / RFC 5639 curve name.
     */
    public String standardName() {
        return standardName;
    }

    public boolean sameCurveAs(CurveType other) {
        return standardName.equals(other.standardName);
    }

    public static Optional<CurveType> fromOcmfName(String name) {
        for (CurveType curve : values()) {
            if (curve.ocmfName.equals(name)) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }
}
