package com.questrail.ocmf.validation;

/**
 * Policy switches for the payload validation pipeline.
 *
 * @param requireMeterSerial     require {@code MS} instead of accepting either
 *                               {@code GS} or {@code MS}
 * @param enforceReadingSequence apply the {@code TX} sequence check to {@code RD}
 */
public record OcmfValidationConfig(
    boolean requireMeterSerial,
    boolean enforceReadingSequence
) {
    public static OcmfValidationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean requireMeterSerial = false;
        private boolean enforceReadingSequence = true;

        public Builder withRequireMeterSerial(boolean requireMeterSerial) {
            this.requireMeterSerial = requireMeterSerial;
            return this;
        }

        public Builder withEnforceReadingSequence(boolean enforceReadingSequence) {
            this.enforceReadingSequence = enforceReadingSequence;
            return this;
        }

        public OcmfValidationConfig build() {
            return new OcmfValidationConfig(requireMeterSerial, enforceReadingSequence);
        }
    }
}
