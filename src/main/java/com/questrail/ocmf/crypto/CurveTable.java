package com.questrail.ocmf.crypto;

import com.questrail.ocmf.model.CurveType;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.params.ECDomainParameters;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * CurveTable
 * -----------------------------------------------------------------------------
 * Domain parameters and object identifiers for every {@link CurveType},
 * resolved once from Bouncy Castle's named curve registry.
 *
 * <p>Where two OCMF spellings name the same curve, an OID resolves to the
 * spelling that equals the standard name ({@code brainpoolP256r1} rather than
 * {@code brainpool256r1}).</p>
 *
 * <p>Both tables are unmodifiable after class initialization.</p>
 */
public final class CurveTable
{
    private static final Map<CurveType, ECDomainParameters> DOMAINS;
    private static final Map<CurveType, ASN1ObjectIdentifier> OIDS;
    private static final Map<ASN1ObjectIdentifier, CurveType> BY_OID;

    static {
        Map<CurveType, ECDomainParameters> domains = new EnumMap<>(CurveType.class);
        Map<CurveType, ASN1ObjectIdentifier> oids = new EnumMap<>(CurveType.class);
        Map<ASN1ObjectIdentifier, CurveType> byOid = new HashMap<>();

        for (CurveType curve : CurveType.values()) {
            X9ECParameters x9 = ECNamedCurveTable.getByName(curve.standardName());
            ASN1ObjectIdentifier oid = ECNamedCurveTable.getOID(curve.standardName());
            if (x9 == null || oid == null) {
                throw new IllegalStateException("Bouncy Castle does not know curve " + curve.standardName());
            }
            domains.put(curve, new ECDomainParameters(x9.getCurve(), x9.getG(), x9.getN(), x9.getH()));
            oids.put(curve, oid);
            if (curve.ocmfName().equals(curve.standardName()) || !byOid.containsKey(oid)) {
                byOid.put(oid, curve);
            }
        }

        DOMAINS = Collections.unmodifiableMap(domains);
        OIDS = Collections.unmodifiableMap(oids);
        BY_OID = Collections.unmodifiableMap(byOid);
    }

    private CurveTable() {}

    public static ECDomainParameters domain(CurveType curve) {
        return DOMAINS.get(curve);
    }

    public static ASN1ObjectIdentifier oid(CurveType curve) {
        return OIDS.get(curve);
    }

    public static Optional<CurveType> fromOid(ASN1ObjectIdentifier oid) {
        return Optional.ofNullable(BY_OID.get(oid));
    }

    /**
     * Field size of the curve in bits (256 for P-256, 521 for P-521).
     */
    public static int keySizeBits(CurveType curve) {
        return DOMAINS.get(curve).getCurve().getFieldSize();
    }
}
