package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Current type of a reading ({@code RT}).
 */
public enum ReadingCurrentType
{
    AC,
    DC;

    public String code() {
        return name();
    }

    public static Optional<ReadingCurrentType> fromCode(String code) {
        for (ReadingCurrentType type : values()) {
            if (type.name().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
