package com.questrail.ocmf.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.ocmf.validation.PayloadValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload
 * -----------------------------------------------------------------------------
 * Metadata and readings of one OCMF record.
 *
 * <h2>Field groups</h2>
 * <ul>
 *   <li>Gateway: {@code FV, GI, GS, GV}</li>
 *   <li>Pagination: {@code PG}</li>
 *   <li>Meter: {@code MV, MM, MS, MF}</li>
 *   <li>User assignment: {@code IS, IL, IF, IT, ID, TT}</li>
 *   <li>Metrologic parameters: {@code CF, LC}</li>
 *   <li>Charge point assignment: {@code CT, CI}</li>
 *   <li>Readings: {@code RD}, order-significant</li>
 * </ul>
 *
 * <p>Keys outside the OCMF field set (vendor extensions such as {@code U..Z})
 * are kept in {@link #extensions()} as opaque JSON in their original order so
 * that a serialized payload still carries them.</p>
 *
 * <p>Lists and maps are copied and wrapped unmodifiable on construction.
 * Cross-field invariants are enforced by {@link PayloadValidator}.</p>
 */
public record Payload(
        String formatVersion,
        String gatewayIdentification,
        String gatewaySerial,
        String gatewayVersion,
        Pagination pagination,
        String meterVendor,
        String meterModel,
        String meterSerial,
        String meterFirmware,
        boolean identificationStatus,
        UserAssignmentStatus identificationLevel,
        List<IdentificationFlag> identificationFlags,
        IdentificationType identificationType,
        String identificationData,
        String tariffText,
        String chargeControllerFirmware,
        CableLossCompensation lossCompensation,
        String chargePointIdentificationType,
        String chargePointIdentification,
        List<Reading> readings,
        Map<String, JsonNode> extensions
)
{
    public static final int MAX_TARIFF_TEXT_LENGTH = 250;
    public static final int MAX_CONTROLLER_FIRMWARE_LENGTH = 25;

    public Payload {
        Objects.requireNonNull(pagination, "pagination");
        identificationFlags = identificationFlags == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(identificationFlags));
        if (identificationType == null) {
            identificationType = IdentificationType.NONE;
        }
        readings = readings == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(readings));
        extensions = extensions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * Serial number that identifies the signing component: {@code GS} if
     * non-empty, otherwise {@code MS}.
     */
    public Optional<String> serialNumber() {
        if (gatewaySerial != null && !gatewaySerial.isEmpty()) {
            return Optional.of(gatewaySerial);
        }
        if (meterSerial != null && !meterSerial.isEmpty()) {
            return Optional.of(meterSerial);
        }
        return Optional.empty();
    }

    public Optional<ChargePointIdentificationType> knownChargePointIdentificationType() {
        return ChargePointIdentificationType.fromCode(chargePointIdentificationType);
    }

    public Optional<Reading> firstReading() {
        return readings.isEmpty() ? Optional.empty() : Optional.of(readings.get(0));
    }

    public Optional<Reading> lastReading() {
        return readings.isEmpty() ? Optional.empty() : Optional.of(readings.get(readings.size() - 1));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.formatVersion = formatVersion;
        b.gatewayIdentification = gatewayIdentification;
        b.gatewaySerial = gatewaySerial;
        b.gatewayVersion = gatewayVersion;
        b.pagination = pagination;
        b.meterVendor = meterVendor;
        b.meterModel = meterModel;
        b.meterSerial = meterSerial;
        b.meterFirmware = meterFirmware;
        b.identificationStatus = identificationStatus;
        b.identificationLevel = identificationLevel;
        b.identificationFlags = new ArrayList<>(identificationFlags);
        b.identificationType = identificationType;
        b.identificationData = identificationData;
        b.tariffText = tariffText;
        b.chargeControllerFirmware = chargeControllerFirmware;
        b.lossCompensation = lossCompensation;
        b.chargePointIdentificationType = chargePointIdentificationType;
        b.chargePointIdentification = chargePointIdentification;
        b.readings = new ArrayList<>(readings);
        b.extensions = new LinkedHashMap<>(extensions);
        return b;
    }

    public static final class Builder
    {
        private String formatVersion;
        private String gatewayIdentification;
        private String gatewaySerial;
        private String gatewayVersion;
        private Pagination pagination;
        private String meterVendor;
        private String meterModel;
        private String meterSerial;
        private String meterFirmware;
        private boolean identificationStatus;
        private UserAssignmentStatus identificationLevel;
        private List<IdentificationFlag> identificationFlags = new ArrayList<>();
        private IdentificationType identificationType = IdentificationType.NONE;
        private String identificationData;
        private String tariffText;
        private String chargeControllerFirmware;
        private CableLossCompensation lossCompensation;
        private String chargePointIdentificationType;
        private String chargePointIdentification;
        private List<Reading> readings = new ArrayList<>();
        private Map<String, JsonNode> extensions = new LinkedHashMap<>();

        public Builder withFormatVersion(String formatVersion) {
            this.formatVersion = formatVersion;
            return this;
        }

        public Builder withGatewayIdentification(String gatewayIdentification) {
            this.gatewayIdentification = gatewayIdentification;
            return this;
        }

        public Builder withGatewaySerial(String gatewaySerial) {
            this.gatewaySerial = gatewaySerial;
            return this;
        }

        public Builder withGatewayVersion(String gatewayVersion) {
            this.gatewayVersion = gatewayVersion;
            return this;
        }

        public Builder withPagination(Pagination pagination) {
            this.pagination = pagination;
            return this;
        }

        public Builder withPagination(String pagination) {
            this.pagination = Pagination.parse(pagination);
            return this;
        }

        public Builder withMeterVendor(String meterVendor) {
            this.meterVendor = meterVendor;
            return this;
        }

        public Builder withMeterModel(String meterModel) {
            this.meterModel = meterModel;
            return this;
        }

        public Builder withMeterSerial(String meterSerial) {
            this.meterSerial = meterSerial;
            return this;
        }

        public Builder withMeterFirmware(String meterFirmware) {
            this.meterFirmware = meterFirmware;
            return this;
        }

        public Builder withIdentificationStatus(boolean identificationStatus) {
            this.identificationStatus = identificationStatus;
            return this;
        }

        public Builder withIdentificationLevel(UserAssignmentStatus identificationLevel) {
            this.identificationLevel = identificationLevel;
            return this;
        }

        public Builder withIdentificationFlags(List<IdentificationFlag> identificationFlags) {
            this.identificationFlags = new ArrayList<>(identificationFlags);
            return this;
        }

        public Builder withIdentificationType(IdentificationType identificationType) {
            this.identificationType = identificationType;
            return this;
        }

        public Builder withIdentificationData(String identificationData) {
            this.identificationData = identificationData;
            return this;
        }

        public Builder withTariffText(String tariffText) {
            this.tariffText = tariffText;
            return this;
        }

        public Builder withChargeControllerFirmware(String chargeControllerFirmware) {
            this.chargeControllerFirmware = chargeControllerFirmware;
            return this;
        }

        public Builder withLossCompensation(CableLossCompensation lossCompensation) {
            this.lossCompensation = lossCompensation;
            return this;
        }

        public Builder withChargePointIdentificationType(String chargePointIdentificationType) {
            this.chargePointIdentificationType = chargePointIdentificationType;
            return this;
        }

        public Builder withChargePointIdentification(String chargePointIdentification) {
            this.chargePointIdentification = chargePointIdentification;
            return this;
        }

        public Builder withReadings(List<Reading> readings) {
            this.readings = new ArrayList<>(readings);
            return this;
        }

        public Builder addReading(Reading reading) {
            this.readings.add(reading);
            return this;
        }

        public Builder withExtension(String key, JsonNode value) {
            this.extensions.put(key, value);
            return this;
        }

        /**
         * Assembles the payload without running the validation pipeline.
         *
         * <p>For callers that validate separately, as the decoder does with its
         * own {@link com.questrail.ocmf.validation.OcmfValidationConfig}. A
         * payload built this way may violate the field invariants; use
         * {@link #build()} otherwise.</p>
         */
        public Payload buildUnvalidated() {
            return new Payload(formatVersion, gatewayIdentification, gatewaySerial, gatewayVersion,
                    pagination, meterVendor, meterModel, meterSerial, meterFirmware,
                    identificationStatus, identificationLevel, identificationFlags,
                    identificationType, identificationData, tariffText, chargeControllerFirmware,
                    lossCompensation, chargePointIdentificationType, chargePointIdentification,
                    readings, extensions);
        }

        /**
         * @throws com.questrail.ocmf.error.OcmfException with kind VALIDATION if
         *         an invariant is violated under the default configuration
         */
        public Payload build() {
            return PayloadValidator.defaults().validate(buildUnvalidated()).orElseThrow();
        }
    }
}
