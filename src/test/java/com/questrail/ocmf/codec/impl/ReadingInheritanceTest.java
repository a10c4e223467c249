package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ReadingInheritanceTest
{
    private static ObjectNode node(String json) throws Exception
    {
        return (ObjectNode) OcmfJson.MAPPER.readTree(json);
    }

    @Test
    void inheritsFromClosestEarlierReading() throws Exception
    {
        List<ObjectNode> resolved = ReadingInheritance.apply(List.of(
                node("{\"TM\":\"a\",\"TX\":\"B\",\"ST\":\"G\",\"RV\":1}"),
                node("{\"TX\":\"C\",\"ST\":\"E\"}"),
                node("{\"TX\":\"E\"}")));

        assertEquals("a", resolved.get(2).get("TM").asText());
        assertEquals("E", resolved.get(2).get("ST").asText());
        assertEquals("E", resolved.get(2).get("TX").asText());
    }

    @Test
    void valuesAreNeverInherited() throws Exception
    {
        List<ObjectNode> resolved = ReadingInheritance.apply(List.of(
                node("{\"TM\":\"a\",\"RV\":1,\"CL\":0}"),
                node("{}")));

        assertFalse(resolved.get(1).has("RV"));
        assertFalse(resolved.get(1).has("CL"));
    }

    @Test
    void inputIsNotModified() throws Exception
    {
        ObjectNode second = node("{}");
        ReadingInheritance.apply(List.of(node("{\"TM\":\"a\"}"), second));
        assertEquals(0, second.size());
    }
}
