package com.questrail.ocmf.crypto;

import com.questrail.ocmf.model.CurveType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class CurveTableTest
{
    @Test
    void everyCurveIsResolved()
    {
        for (CurveType curve : CurveType.values()) {
            assertNotNull(CurveTable.domain(curve), curve::name);
            assertNotNull(CurveTable.oid(curve), curve::name);
        }
    }

    @Test
    void keySizes()
    {
        assertEquals(192, CurveTable.keySizeBits(CurveType.SECP192K1));
        assertEquals(256, CurveTable.keySizeBits(CurveType.SECP256K1));
        assertEquals(384, CurveTable.keySizeBits(CurveType.BRAINPOOL384R1));
        assertEquals(521, CurveTable.keySizeBits(CurveType.SECP521R1));
    }

    @Test
    void oidLookupPrefersStandardSpelling()
    {
        assertEquals(CurveTable.oid(CurveType.BRAINPOOL256R1), CurveTable.oid(CurveType.BRAINPOOLP256R1));
        assertEquals(CurveType.BRAINPOOLP256R1,
                CurveTable.fromOid(CurveTable.oid(CurveType.BRAINPOOL256R1)).orElseThrow());
        assertEquals(CurveType.SECP256R1, CurveTable.fromOid(CurveTable.oid(CurveType.SECP256R1)).orElseThrow());
    }
}
