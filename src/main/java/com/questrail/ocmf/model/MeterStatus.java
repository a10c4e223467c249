package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Meter status at the time of a reading ({@code ST}). Only {@link #OK} is
 * acceptable for billing.
 */
public enum MeterStatus
{
    NOT_PRESENT("N"),
    OK("G"),
    TIMEOUT("T"),
    DISCONNECTED("D"),
    NOT_FOUND("R"),
    MANIPULATED("M"),
    EXCHANGED("X"),
    INCOMPATIBLE("I"),
    OUT_OF_RANGE("O"),
    SUBSTITUTE("S"),
    OTHER_ERROR("E"),
    READ_ERROR("F");

    private final String code;

    MeterStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<MeterStatus> fromCode(String code) {
        for (MeterStatus status : values()) {
            if (status.code.equals(code)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
