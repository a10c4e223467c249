package com.questrail.ocmf.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.model.CableLossCompensation;
import com.questrail.ocmf.model.IdentificationFlag;
import com.questrail.ocmf.model.IdentificationType;
import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.MeterStatus;
import com.questrail.ocmf.model.OcmfTimestamp;
import com.questrail.ocmf.model.OcmfUnit;
import com.questrail.ocmf.model.Pagination;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Reading;
import com.questrail.ocmf.model.ReadingCurrentType;
import com.questrail.ocmf.model.UserAssignmentStatus;
import com.questrail.ocmf.obis.ObisCode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.questrail.ocmf.codec.impl.JsonFields.invalid;
import static com.questrail.ocmf.codec.impl.JsonFields.missing;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalCode;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalDecimal;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalInteger;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalParsed;
import static com.questrail.ocmf.codec.impl.JsonFields.optionalString;
import static com.questrail.ocmf.codec.impl.JsonFields.present;
import static com.questrail.ocmf.codec.impl.JsonFields.requiredBoolean;
import static com.questrail.ocmf.codec.impl.JsonFields.requiredCode;
import static com.questrail.ocmf.codec.impl.JsonFields.requiredParsed;

/**
 * PayloadMapper
 * -----------------------------------------------------------------------------
 * Maps the payload JSON object onto {@link Payload}.
 *
 * <p>Only structure is checked here: required keys, JSON types, code tables,
 * value-type formats. The cross-field rules run afterwards in
 * {@link com.questrail.ocmf.validation.PayloadValidator}.</p>
 *
 * <h2>Coercions</h2>
 * <ul>
 *   <li>{@code FV} given as a number is kept as its text</li>
 *   <li>{@code CT} of {@code ""} or {@code 0} is treated as absent; other numbers become text</li>
 *   <li>{@code EF} of {@code ""} is treated as absent</li>
 *   <li>{@code RV} and {@code CL} accept numbers or numeric strings</li>
 * </ul>
 */
final class PayloadMapper
{
    static final Set<String> FIELDS = Set.of(
            "FV", "GI", "GS", "GV", "PG", "MV", "MM", "MS", "MF",
            "IS", "IL", "IF", "IT", "ID", "TT", "CF", "LC", "CT", "CI", "RD");

    private static final String STATUS_CODES = codes(MeterStatus.values(), MeterStatus::code);
    private static final String REASON_CODES = codes(MeterReadingReason.values(), MeterReadingReason::code);
    private static final String UNIT_CODES = codes(OcmfUnit.values(), OcmfUnit::code);
    private static final String CURRENT_CODES = codes(ReadingCurrentType.values(), ReadingCurrentType::code);
    private static final String LEVEL_CODES = codes(UserAssignmentStatus.values(), UserAssignmentStatus::code);
    private static final String TYPE_CODES = codes(IdentificationType.values(), IdentificationType::code);

    private PayloadMapper() {}

    static Payload map(JsonNode root) throws WireFormatException {
        if (!root.isObject()) {
            throw invalid("payload", "must be a JSON object");
        }

        Payload.Builder b = Payload.builder()
                .withFormatVersion(formatVersion(root))
                .withGatewayIdentification(optionalString(root, "GI").orElse(null))
                .withGatewaySerial(optionalString(root, "GS").orElse(null))
                .withGatewayVersion(optionalString(root, "GV").orElse(null))
                .withPagination(requiredParsed(root, "PG", Pagination::parse))
                .withMeterVendor(optionalString(root, "MV").orElse(null))
                .withMeterModel(optionalString(root, "MM").orElse(null))
                .withMeterSerial(optionalString(root, "MS").orElse(null))
                .withMeterFirmware(optionalString(root, "MF").orElse(null))
                .withIdentificationStatus(requiredBoolean(root, "IS"))
                .withIdentificationLevel(optionalCode(root, "IL", UserAssignmentStatus::fromCode, LEVEL_CODES).orElse(null))
                .withIdentificationFlags(identificationFlags(root))
                .withIdentificationType(optionalCode(root, "IT", IdentificationType::fromCode, TYPE_CODES)
                        .orElse(IdentificationType.NONE))
                .withIdentificationData(optionalString(root, "ID").orElse(null))
                .withTariffText(optionalString(root, "TT").orElse(null))
                .withChargeControllerFirmware(optionalString(root, "CF").orElse(null))
                .withLossCompensation(lossCompensation(root))
                .withChargePointIdentificationType(chargePointType(root))
                .withChargePointIdentification(optionalString(root, "CI").orElse(null))
                .withReadings(readings(root));

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!FIELDS.contains(field.getKey())) {
                b.withExtension(field.getKey(), field.getValue());
            }
        }
        return b.buildUnvalidated();
    }

    private static String formatVersion(JsonNode root) throws WireFormatException {
        if (present(root, "FV") && root.get("FV").isNumber()) {
            return root.get("FV").asText();
        }
        return optionalString(root, "FV").orElse(null);
    }

    private static String chargePointType(JsonNode root) throws WireFormatException {
        if (!present(root, "CT")) {
            return null;
        }
        JsonNode ct = root.get("CT");
        if (ct.isNumber()) {
            return ct.decimalValue().signum() == 0 ? null : ct.asText();
        }
        String text = optionalString(root, "CT").orElse("");
        return text.isEmpty() ? null : text;
    }

    private static List<IdentificationFlag> identificationFlags(JsonNode root) throws WireFormatException {
        if (!present(root, "IF")) {
            return List.of();
        }
        JsonNode array = root.get("IF");
        if (!array.isArray()) {
            throw invalid("IF", "must be an array (was " + array.getNodeType() + ")");
        }
        List<IdentificationFlag> flags = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw invalid("IF", "entries must be strings (was " + element + ")");
            }
            flags.add(IdentificationFlag.fromCode(element.textValue())
                    .orElseThrow(() -> invalid("IF", "unknown flag '" + element.textValue() + "'")));
        }
        return flags;
    }

    private static CableLossCompensation lossCompensation(JsonNode root) throws WireFormatException {
        if (!present(root, "LC")) {
            return null;
        }
        JsonNode lc = root.get("LC");
        if (!lc.isObject()) {
            throw invalid("LC", "must be an object (was " + lc.getNodeType() + ")");
        }
        BigDecimal resistance = optionalDecimal(lc, "LR").orElseThrow(() -> missing("LC.LR"));
        OcmfUnit unit = requiredCode(lc, "LU", OcmfUnit::fromCode, UNIT_CODES);
        try {
            return new CableLossCompensation(
                    optionalString(lc, "LN").orElse(null),
                    optionalInteger(lc, "LI").orElse(null),
                    resistance,
                    unit);
        }
        catch (IllegalArgumentException e) {
            throw invalid("LC", e.getMessage());
        }
    }

    private static List<Reading> readings(JsonNode root) throws WireFormatException {
        if (!present(root, "RD")) {
            throw missing("RD");
        }
        JsonNode array = root.get("RD");
        if (!array.isArray()) {
            throw invalid("RD", "must be an array (was " + array.getNodeType() + ")");
        }
        List<ObjectNode> raw = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (!array.get(i).isObject()) {
                throw invalid("RD[" + i + "]", "must be an object");
            }
            raw.add((ObjectNode) array.get(i));
        }

        List<ObjectNode> resolved = ReadingInheritance.apply(raw);
        List<Reading> readings = new ArrayList<>(resolved.size());
        for (int i = 0; i < resolved.size(); i++) {
            try {
                readings.add(reading(resolved.get(i)));
            }
            catch (WireFormatException e) {
                String field = "RD[" + i + "]" + e.error().fieldName().map(f -> "." + f).orElse("");
                throw new WireFormatException(OcmfError.validation(field, "Reading " + i + ": " + e.error().message()));
            }
        }
        return readings;
    }

    private static Reading reading(JsonNode node) throws WireFormatException {
        OcmfTimestamp timestamp = requiredParsed(node, "TM", OcmfTimestamp::parse);
        MeterReadingReason reason = optionalCode(node, "TX", MeterReadingReason::fromCode, REASON_CODES).orElse(null);
        BigDecimal value = optionalDecimal(node, "RV").orElse(null);
        ObisCode identification = optionalParsed(node, "RI", ObisCode::parse).orElse(null);
        OcmfUnit unit = requiredCode(node, "RU", OcmfUnit::fromCode, UNIT_CODES);
        ReadingCurrentType currentType = optionalCode(node, "RT", ReadingCurrentType::fromCode, CURRENT_CODES).orElse(null);
        BigDecimal loss = optionalDecimal(node, "CL").orElse(null);
        String errorFlags = optionalString(node, "EF").filter(ef -> !ef.isEmpty()).orElse(null);
        MeterStatus status = requiredCode(node, "ST", MeterStatus::fromCode, STATUS_CODES);

        return new Reading(timestamp, reason, value, identification, unit, currentType, loss, errorFlags, status);
    }

    private static <E> String codes(E[] values, Function<E, String> code) {
        return Arrays.stream(values).map(code).collect(Collectors.joining(", "));
    }
}
