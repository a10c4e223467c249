package com.questrail.ocmf.model;

import com.questrail.ocmf.obis.ObisCode;
import com.questrail.ocmf.validation.ReadingValidator;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Reading
 * -----------------------------------------------------------------------------
 * One meter sample inside a payload's {@code RD} list.
 *
 * <h2>Field mapping</h2>
 * <pre>
 *   TM  timestamp      (required)
 *   TX  reason         (optional)
 *   RV  value          (required when RI is present)
 *   RI  identification (OBIS code, grouped with RU)
 *   RU  unit           (required)
 *   RT  currentType    (optional)
 *   CL  cumulatedLoss  (optional, accumulation registers only)
 *   EF  errorFlags     (optional, characters from {E, t})
 *   ST  status         (required)
 * </pre>
 *
 * <p>The canonical constructor only rejects missing required fields. The
 * cross-field invariants are enforced by {@link ReadingValidator}, which
 * {@link Builder#build()} and the decoder both run.</p>
 */
public record Reading(
        OcmfTimestamp timestamp,
        MeterReadingReason reason,
        BigDecimal value,
        ObisCode identification,
        OcmfUnit unit,
        ReadingCurrentType currentType,
        BigDecimal cumulatedLoss,
        String errorFlags,
        MeterStatus status
)
{
    public Reading {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(status, "status");
    }

    public Optional<MeterReadingReason> reasonIfPresent() {
        return Optional.ofNullable(reason);
    }

    public boolean isBegin() {
        return reason != null && reason.isBegin();
    }

    public boolean isEnd() {
        return reason != null && reason.isEndReading();
    }

    public boolean hasErrorFlags() {
        return errorFlags != null && !errorFlags.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copies every field into a builder, for deriving a modified reading.
     */
    public Builder toBuilder() {
        return new Builder()
                .withTimestamp(timestamp)
                .withReason(reason)
                .withValue(value)
                .withIdentification(identification)
                .withUnit(unit)
                .withCurrentType(currentType)
                .withCumulatedLoss(cumulatedLoss)
                .withErrorFlags(errorFlags)
                .withStatus(status);
    }

    public static final class Builder
    {
        private OcmfTimestamp timestamp;
        private MeterReadingReason reason;
        private BigDecimal value;
        private ObisCode identification;
        private OcmfUnit unit;
        private ReadingCurrentType currentType;
        private BigDecimal cumulatedLoss;
        private String errorFlags;
        private MeterStatus status;

        public Builder withTimestamp(OcmfTimestamp timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder withTimestamp(String timestamp) {
            this.timestamp = OcmfTimestamp.parse(timestamp);
            return this;
        }

        public Builder withReason(MeterReadingReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder withValue(BigDecimal value) {
            this.value = value;
            return this;
        }

        public Builder withValue(String value) {
            this.value = new BigDecimal(value);
            return this;
        }

        public Builder withIdentification(ObisCode identification) {
            this.identification = identification;
            return this;
        }

        public Builder withIdentification(String identification) {
            this.identification = ObisCode.parse(identification);
            return this;
        }

        public Builder withUnit(OcmfUnit unit) {
            this.unit = unit;
            return this;
        }

        public Builder withCurrentType(ReadingCurrentType currentType) {
            this.currentType = currentType;
            return this;
        }

        public Builder withCumulatedLoss(BigDecimal cumulatedLoss) {
            this.cumulatedLoss = cumulatedLoss;
            return this;
        }

        public Builder withCumulatedLoss(String cumulatedLoss) {
            this.cumulatedLoss = new BigDecimal(cumulatedLoss);
            return this;
        }

        public Builder withErrorFlags(String errorFlags) {
            this.errorFlags = errorFlags;
            return this;
        }

        public Builder withStatus(MeterStatus status) {
            this.status = status;
            return this;
        }

        /**
         * @throws com.questrail.ocmf.error.OcmfException with kind VALIDATION if
         *         an invariant is violated
         */
        public Reading build() {
            Reading reading = new Reading(timestamp, reason, value, identification, unit,
                    currentType, cumulatedLoss, errorFlags, status);
            return ReadingValidator.validate(reading).orElseThrow();
        }
    }
}
