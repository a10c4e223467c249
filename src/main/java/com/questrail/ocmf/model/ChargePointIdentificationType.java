package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Known charge point identification schemes ({@code CT}). Vendors also emit
 * other values, so the payload keeps {@code CT} as text.
 */
public enum ChargePointIdentificationType
{
    EVSEID,
    CBIDC;

    public static Optional<ChargePointIdentificationType> fromCode(String code) {
        for (ChargePointIdentificationType type : values()) {
            if (type.name().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
