package com.questrail.ocmf.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PaginationTest
{
    @Test
    void parsesTransactionAndFiscalTokens()
    {
        Pagination t = Pagination.parse("T32");
        assertEquals(Pagination.Context.TRANSACTION, t.context());
        assertEquals(32, t.number());
        assertEquals("T32", t.toString());

        Pagination f = Pagination.parse("F1");
        assertEquals(Pagination.Context.FISCAL, f.context());
        assertEquals(1, f.number());
    }

    @Test
    void rejectsZeroLeadingZeroAndUnknownPrefix()
    {
        assertThrows(IllegalArgumentException.class, () -> Pagination.parse("T0"));
        assertThrows(IllegalArgumentException.class, () -> Pagination.parse("T01"));
        assertThrows(IllegalArgumentException.class, () -> Pagination.parse("F00"));
        assertThrows(IllegalArgumentException.class, () -> Pagination.parse("X1"));
        assertThrows(IllegalArgumentException.class, () -> Pagination.parse("T"));
        assertThrows(IllegalArgumentException.class, () -> Pagination.of(Pagination.Context.FISCAL, 0));
    }

    @Test
    void consecutiveCounters()
    {
        assertTrue(Pagination.parse("T3").isFollowedBy(Pagination.parse("T4")));
        assertFalse(Pagination.parse("T1").isFollowedBy(Pagination.parse("T5")));
        assertFalse(Pagination.parse("T4").isFollowedBy(Pagination.parse("T3")));
    }

    @Test
    void valueEquality()
    {
        assertEquals(Pagination.parse("F7"), Pagination.of(Pagination.Context.FISCAL, 7));
        assertNotEquals(Pagination.parse("F7"), Pagination.parse("T7"));
    }
}
