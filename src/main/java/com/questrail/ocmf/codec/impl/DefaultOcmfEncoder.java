package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.ocmf.codec.OcmfEncoder;
import com.questrail.ocmf.codec.TextEncodings;
import com.questrail.ocmf.model.CableLossCompensation;
import com.questrail.ocmf.model.IdentificationFlag;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Reading;
import com.questrail.ocmf.model.Signature;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultOcmfEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OcmfEncoder}.
 *
 * <h2>Field order</h2>
 * <pre>
 *   payload   FV GI GS GV PG MV MM MS MF IS IL IF IT ID TT CF LC CT CI RD, then extensions
 *   reading   TM TX RV RI RU RT CL EF ST
 *   signature SA SE SM SD PK KT, then extensions
 * </pre>
 *
 * Absent fields are omitted. Decimals are written in plain notation with
 * their scale.
 */
public final class DefaultOcmfEncoder implements OcmfEncoder
{
    @Override
    public String encode(Ocmf record, boolean hex)
    {
        Objects.requireNonNull(record, "record");

        final String text = Ocmf.HEADER
                + Ocmf.SEPARATOR + write(payloadNode(record.payload()))
                + Ocmf.SEPARATOR + write(signatureNode(record.signature()));

        return hex ? TextEncodings.encodeHex(text.getBytes(StandardCharsets.UTF_8)) : text;
    }

    private static ObjectNode payloadNode(Payload p)
    {
        final ObjectNode node = OcmfJson.MAPPER.createObjectNode();
        putText(node, "FV", p.formatVersion());
        putText(node, "GI", p.gatewayIdentification());
        putText(node, "GS", p.gatewaySerial());
        putText(node, "GV", p.gatewayVersion());
        node.put("PG", p.pagination().toString());
        putText(node, "MV", p.meterVendor());
        putText(node, "MM", p.meterModel());
        putText(node, "MS", p.meterSerial());
        putText(node, "MF", p.meterFirmware());
        node.put("IS", p.identificationStatus());
        if (p.identificationLevel() != null) {
            node.put("IL", p.identificationLevel().code());
        }
        final ArrayNode flags = node.putArray("IF");
        for (IdentificationFlag flag : p.identificationFlags()) {
            flags.add(flag.code());
        }
        node.put("IT", p.identificationType().code());
        putText(node, "ID", p.identificationData());
        putText(node, "TT", p.tariffText());
        putText(node, "CF", p.chargeControllerFirmware());
        if (p.lossCompensation() != null) {
            node.set("LC", lossCompensationNode(p.lossCompensation()));
        }
        putText(node, "CT", p.chargePointIdentificationType());
        putText(node, "CI", p.chargePointIdentification());

        final ArrayNode readings = node.putArray("RD");
        for (Reading reading : p.readings()) {
            readings.add(readingNode(reading));
        }

        for (Map.Entry<String, JsonNode> extension : p.extensions().entrySet()) {
            node.set(extension.getKey(), extension.getValue());
        }
        return node;
    }

    private static ObjectNode lossCompensationNode(CableLossCompensation lc)
    {
        final ObjectNode node = OcmfJson.MAPPER.createObjectNode();
        putText(node, "LN", lc.naming());
        if (lc.identification() != null) {
            node.put("LI", lc.identification().longValue());
        }
        node.put("LR", lc.resistance());
        node.put("LU", lc.unit().code());
        return node;
    }

    private static ObjectNode readingNode(Reading r)
    {
        final ObjectNode node = OcmfJson.MAPPER.createObjectNode();
        node.put("TM", r.timestamp().toString());
        if (r.reason() != null) {
            node.put("TX", r.reason().code());
        }
        putDecimal(node, "RV", r.value());
        if (r.identification() != null) {
            node.put("RI", r.identification().toString());
        }
        node.put("RU", r.unit().code());
        if (r.currentType() != null) {
            node.put("RT", r.currentType().code());
        }
        putDecimal(node, "CL", r.cumulatedLoss());
        putText(node, "EF", r.errorFlags());
        node.put("ST", r.status().code());
        return node;
    }

    private static ObjectNode signatureNode(Signature s)
    {
        final ObjectNode node = OcmfJson.MAPPER.createObjectNode();
        node.put("SA", s.algorithm());
        node.put("SE", s.encoding().code());
        node.put("SM", s.mimeType());
        node.put("SD", s.data());
        putText(node, "PK", s.publicKey());
        putText(node, "KT", s.keyType());
        for (Map.Entry<String, JsonNode> extension : s.extensions().entrySet()) {
            node.set(extension.getKey(), extension.getValue());
        }
        return node;
    }

    private static void putText(ObjectNode node, String field, String value)
    {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putDecimal(ObjectNode node, String field, BigDecimal value)
    {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String write(ObjectNode node)
    {
        try {
            return OcmfJson.MAPPER.writeValueAsString(node);
        }
        catch (JsonProcessingException e) {
            // A tree built from model values always serializes.
            throw new IllegalStateException("Unable to write OCMF section", e);
        }
    }
}
