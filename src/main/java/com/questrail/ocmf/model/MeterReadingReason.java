package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Reason a reading was taken ({@code TX}).
 *
 * <p>Reasons fall into three groups that drive the reading-sequence rules:
 * {@link #BEGIN}; the end group ({@code E,L,R,A,P}); and the intermediate group
 * ({@code C,X,S,T}).</p>
 */
public enum MeterReadingReason
{
    BEGIN("B"),
    CHARGING("C"),
    EXCEPTION("X"),
    END("E"),
    TERMINATION_LOCAL("L"),
    TERMINATION_REMOTE("R"),
    TERMINATION_ABORT("A"),
    TERMINATION_POWER_FAILURE("P"),
    SUSPENDED("S"),
    TARIFF_CHANGE("T");

    private final String code;

    MeterReadingReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isBegin() {
        return this == BEGIN;
    }

    public boolean isEndReading() {
        return switch (this) {
            case END, TERMINATION_LOCAL, TERMINATION_REMOTE, TERMINATION_ABORT, TERMINATION_POWER_FAILURE -> true;
            default -> false;
        };
    }

    public boolean isIntermediate() {
        return switch (this) {
            case CHARGING, EXCEPTION, SUSPENDED, TARIFF_CHANGE -> true;
            default -> false;
        };
    }

    public static Optional<MeterReadingReason> fromCode(String code) {
        for (MeterReadingReason reason : values()) {
            if (reason.code.equals(code)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
