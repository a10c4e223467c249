package com.questrail.ocmf.validation;

import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.IdentificationFlag;
import com.questrail.ocmf.model.IdentificationFormat;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Reading;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PayloadValidator
 * -----------------------------------------------------------------------------
 * Ordered validation pipeline for a {@link Payload}.
 *
 * <h2>Order</h2>
 * <ol>
 *   <li>field lengths ({@code TT}, {@code CF})</li>
 *   <li>serial number ({@code GS} or {@code MS}, or {@code MS} alone when configured)</li>
 *   <li>every reading through {@link ReadingValidator}</li>
 *   <li>identification flags do not mix sources</li>
 *   <li>identification data matches the format of the identification type</li>
 *   <li>reading {@code TX} sequence, for two or more readings</li>
 * </ol>
 *
 * <p>Validation is fail-fast: the first violation in this order is returned.
 * Pagination and timestamps are checked while their value types are parsed,
 * before a payload exists.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class PayloadValidator
{
    private static final PayloadValidator DEFAULTS = new PayloadValidator(OcmfValidationConfig.defaults());

    private final OcmfValidationConfig config;
    private final TransactionSequenceReducer sequenceReducer = new TransactionSequenceReducer();
    private final List<ValidationRule<Payload>> rules;

    public PayloadValidator(OcmfValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.rules = List.of(
                PayloadValidator::checkLengths,
                this::checkSerialNumber,
                PayloadValidator::checkReadings,
                PayloadValidator::checkIdentificationFlags,
                PayloadValidator::checkIdentificationData,
                this::checkReadingSequence
        );
    }

    public static PayloadValidator defaults() {
        return DEFAULTS;
    }

    public OcmfValidationConfig config() {
        return config;
    }

    public OcmfResult<Payload> validate(Payload payload) {
        Objects.requireNonNull(payload, "payload");
        for (ValidationRule<Payload> rule : rules) {
            Optional<OcmfError> violation = rule.check(payload);
            if (violation.isPresent()) {
                return OcmfResult.failure(violation.get());
            }
        }
        return OcmfResult.success(payload);
    }

    // ---------------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------------

    private static Optional<OcmfError> checkLengths(Payload p) {
        if (p.tariffText() != null && p.tariffText().length() > Payload.MAX_TARIFF_TEXT_LENGTH) {
            return Optional.of(OcmfError.validation("TT", "TT (Tariff Text) must be at most "
                    + Payload.MAX_TARIFF_TEXT_LENGTH + " characters (was " + p.tariffText().length() + ")"));
        }
        String cf = p.chargeControllerFirmware();
        if (cf != null && cf.length() > Payload.MAX_CONTROLLER_FIRMWARE_LENGTH) {
            return Optional.of(OcmfError.validation("CF", "CF (Charge Controller Firmware) must be at most "
                    + Payload.MAX_CONTROLLER_FIRMWARE_LENGTH + " characters (was " + cf.length() + ")"));
        }
        return Optional.empty();
    }

    private Optional<OcmfError> checkSerialNumber(Payload p) {
        if (config.requireMeterSerial()) {
            if (isBlank(p.meterSerial())) {
                return Optional.of(OcmfError.validation("MS", "Meter Serial (MS) must be provided"));
            }
            return Optional.empty();
        }
        if (isBlank(p.gatewaySerial()) && isBlank(p.meterSerial())) {
            return Optional.of(OcmfError.validation("GS/MS",
                    "Either Gateway Serial (GS) or Meter Serial (MS) must be provided"));
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkReadings(Payload p) {
        List<Reading> readings = p.readings();
        for (int i = 0; i < readings.size(); i++) {
            Optional<OcmfError> error = ReadingValidator.validate(readings.get(i)).error();
            if (error.isPresent()) {
                return Optional.of(atReading(i, error.get()));
            }
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkIdentificationFlags(Payload p) {
        List<IdentificationFlag> flags = p.identificationFlags();
        if (flags.size() <= 1 || flags.stream().allMatch(IdentificationFlag::isNone)) {
            return Optional.empty();
        }
        Set<IdentificationFlag.Source> sources = EnumSet.noneOf(IdentificationFlag.Source.class);
        for (IdentificationFlag flag : flags) {
            sources.add(flag.source());
        }
        if (sources.size() > 1) {
            String found = sources.stream().map(Enum::name).sorted().collect(Collectors.joining(", "));
            return Optional.of(OcmfError.validation("IF",
                    "IF (Identification Flags) cannot mix flags from different sources. Found: " + found));
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkIdentificationData(Payload p) {
        IdentificationFormat format = p.identificationType().format();
        String data = p.identificationData();

        if (format instanceof IdentificationFormat.NoData) {
            if (data != null && !data.isEmpty()) {
                return Optional.of(OcmfError.validation("ID", "ID must be absent or empty when IT="
                        + p.identificationType().code() + " (was '" + data + "')"));
            }
            return Optional.empty();
        }

        if (data == null || data.isEmpty() || format.accepts(data)) {
            return Optional.empty();
        }
        return Optional.of(OcmfError.validation("ID", "ID value '" + data
                + "' does not match format for identification type '" + p.identificationType().code()
                + "': expected " + format.description()));
    }

    private Optional<OcmfError> checkReadingSequence(Payload p) {
        if (!config.enforceReadingSequence() || p.readings().size() < 2) {
            return Optional.empty();
        }
        return sequenceReducer.check(p.readings());
    }

    private static OcmfError atReading(int index, OcmfError error) {
        String field = "RD[" + index + "]" + error.fieldName().map(f -> "." + f).orElse("");
        return new OcmfError(ErrorKind.VALIDATION, "Reading " + index + ": " + error.message(),
                field, null, error.throwable());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }
}
