package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Identification level ({@code IL}): how trustworthy the user assignment is.
 *
 * <p>The last four constants are error states; a record carrying one of them is
 * not acceptable for billing.</p>
 */
public enum UserAssignmentStatus
{
    NO_ASSIGNMENT("NONE"),
    UNSECURED("HEARSAY"),
    TRUSTED("TRUSTED"),
    VERIFIED("VERIFIED"),
    CERTIFIED("CERTIFIED"),
    SECURE("SECURE"),
    UID_MISMATCH("MISMATCH"),
    CERT_INCORRECT("INVALID"),
    CERT_EXPIRED("OUTDATED"),
    CERT_UNVERIFIED("UNKNOWN");

    private final String code;

    UserAssignmentStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isError() {
        return switch (this) {
            case UID_MISMATCH, CERT_INCORRECT, CERT_EXPIRED, CERT_UNVERIFIED -> true;
            default -> false;
        };
    }

    public static Optional<UserAssignmentStatus> fromCode(String code) {
        for (UserAssignmentStatus status : values()) {
            if (status.code.equals(code)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
