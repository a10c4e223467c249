package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Synchronization status flag appended to every OCMF timestamp.
 */
public enum TimeStatus
{
    UNKNOWN_OR_UNSYNCHRONIZED('U'),
    INFORMATIVE('I'),
    SYNCHRONIZED('S'),
    RELATIVE('R');

    private final char code;

    TimeStatus(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public static Optional<TimeStatus> fromCode(char code) {
        for (TimeStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
