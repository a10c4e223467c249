package com.questrail.ocmf.compliance;

import java.util.Objects;

/**
 * Severity choices for compliance findings whose weight is a matter of policy.
 *
 * @param idMismatchSeverity severity of differing {@code ID} values between the
 *                           begin and end record of a transaction
 */
public record EichrechtPolicy(
    IssueSeverity idMismatchSeverity
) {
    public EichrechtPolicy {
        Objects.requireNonNull(idMismatchSeverity, "idMismatchSeverity");
    }

    public static EichrechtPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IssueSeverity idMismatchSeverity = IssueSeverity.WARNING;

        public Builder withIdMismatchSeverity(IssueSeverity idMismatchSeverity) {
            this.idMismatchSeverity = idMismatchSeverity;
            return this;
        }

        public EichrechtPolicy build() {
            return new EichrechtPolicy(idMismatchSeverity);
        }
    }
}
