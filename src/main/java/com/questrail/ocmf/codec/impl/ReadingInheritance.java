package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Carries reading fields forward within {@code RD}.
 *
 * <p>A reading that omits {@code TM, TX, RI, RU, RT, EF} or {@code ST} takes
 * the value from the closest earlier reading that has it. Other fields are
 * never inherited. Inputs are not modified.</p>
 */
final class ReadingInheritance
{
    static final List<String> INHERITABLE = List.of("TM", "TX", "RI", "RU", "RT", "EF", "ST");

    private ReadingInheritance() {}

    static List<ObjectNode> apply(List<ObjectNode> readings) {
        final Map<String, JsonNode> last = new HashMap<>();
        final List<ObjectNode> resolved = new ArrayList<>(readings.size());

        for (ObjectNode reading : readings) {
            ObjectNode copy = reading.deepCopy();
            for (String field : INHERITABLE) {
                if (copy.has(field)) {
                    last.put(field, copy.get(field));
                }
                else if (last.containsKey(field)) {
                    copy.set(field, last.get(field));
                }
            }
            resolved.add(copy);
        }
        return resolved;
    }
}
