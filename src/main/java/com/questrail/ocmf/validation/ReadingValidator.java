package com.questrail.ocmf.validation;

import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.Reading;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * ReadingValidator
 * -----------------------------------------------------------------------------
 * Cross-field invariants of a single {@link Reading}, checked in this order:
 * <ol>
 *   <li>{@code RI} and {@code RU} are both present or both absent</li>
 *   <li>{@code RV} is present when {@code RI} is</li>
 *   <li>{@code EF} holds only the flags {@code E} and {@code t}</li>
 *   <li>{@code CL} appears only with an accumulation register ({@code B0..B3, C0..C3})</li>
 *   <li>{@code CL} is zero on a {@code TX=B} reading</li>
 *   <li>{@code CL} is not negative</li>
 * </ol>
 * The first violated rule is reported.
 */
public final class ReadingValidator
{
    private static final String CL_REGISTER_MESSAGE =
            "CL (Cumulated Loss) can only appear when RI indicates an accumulation register (B0-B3, C0-C3)";

    private static final List<ValidationRule<Reading>> RULES = List.of(
            ReadingValidator::checkIdentificationUnitGroup,
            ReadingValidator::checkValuePresent,
            ReadingValidator::checkErrorFlags,
            ReadingValidator::checkLossRegister,
            ReadingValidator::checkLossAtBegin,
            ReadingValidator::checkLossNonNegative
    );

    private ReadingValidator() {}

    public static OcmfResult<Reading> validate(Reading reading) {
        for (ValidationRule<Reading> rule : RULES) {
            Optional<OcmfError> violation = rule.check(reading);
            if (violation.isPresent()) {
                return OcmfResult.failure(violation.get());
            }
        }
        return OcmfResult.success(reading);
    }

    private static Optional<OcmfError> checkIdentificationUnitGroup(Reading r) {
        boolean hasIdentification = r.identification() != null;
        boolean hasUnit = r.unit() != null;
        if (hasIdentification != hasUnit) {
            return Optional.of(OcmfError.validation(hasIdentification ? "RU" : "RI",
                    "RI (Reading Identification) and RU (Reading Unit) must both be present or both absent"));
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkValuePresent(Reading r) {
        if (r.identification() != null && r.value() == null) {
            return Optional.of(OcmfError.validation("RV",
                    "RV (Reading Value) is required when RI is present (RI=" + r.identification() + ")"));
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkErrorFlags(Reading r) {
        if (r.errorFlags() == null) {
            return Optional.empty();
        }
        for (char c : r.errorFlags().toCharArray()) {
            if (c != 'E' && c != 't') {
                return Optional.of(OcmfError.validation("EF",
                        "EF (Error Flags) may only contain 'E' and 't' (was '" + r.errorFlags() + "')"));
            }
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkLossRegister(Reading r) {
        if (r.cumulatedLoss() == null) {
            return Optional.empty();
        }
        if (r.identification() == null || !r.identification().isAccumulationRegister()) {
            return Optional.of(OcmfError.validation("CL", CL_REGISTER_MESSAGE
                    + " (RI=" + r.identification() + ")"));
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkLossAtBegin(Reading r) {
        BigDecimal loss = r.cumulatedLoss();
        if (loss != null && loss.signum() != 0 && r.reason() == MeterReadingReason.BEGIN) {
            return Optional.of(OcmfError.validation("CL",
                    "CL (Cumulated Loss) must be 0 when TX=B (was " + loss.toPlainString() + ")"));
        }
        return Optional.empty();
    }

    private static Optional<OcmfError> checkLossNonNegative(Reading r) {
        BigDecimal loss = r.cumulatedLoss();
        if (loss != null && loss.signum() < 0) {
            return Optional.of(OcmfError.validation("CL",
                    "CL (Cumulated Loss) must be non-negative (was " + loss.toPlainString() + ")"));
        }
        return Optional.empty();
    }
}
