package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Identification type ({@code IT}), OCMF table 17. Each constant carries the
 * {@link IdentificationFormat} its identification data must satisfy.
 */
public enum IdentificationType
{
    NONE(new IdentificationFormat.NoData()),
    DENIED(new IdentificationFormat.NoData()),
    UNDEFINED(new IdentificationFormat.NoData()),
    ISO14443(IdentificationFormat.matching("[0-9a-fA-F]{8}|[0-9a-fA-F]{14}", "4 or 7 byte UID as 8 or 14 hex characters")),
    ISO15693(IdentificationFormat.matching("[0-9a-fA-F]{16}", "8 byte UID as 16 hex characters")),
    EMAID(IdentificationFormat.matching("[A-Za-z0-9]{14,15}", "14 or 15 alphanumeric characters")),
    EVCCID(new IdentificationFormat.MaxLength(6)),
    EVCOID(IdentificationFormat.matching("[A-Z]{2,3}-[A-Z0-9]{2,3}-[0-9]{6}-[0-9]", "DIN 91286 contract ID, e.g. NL-TNM-012204-5")),
    ISO7812(IdentificationFormat.matching("[0-9]{8,19}", "8 to 19 digits")),
    CARD_TXN_NR(new IdentificationFormat.Unrestricted()),
    CENTRAL(new IdentificationFormat.Unrestricted()),
    CENTRAL_1(new IdentificationFormat.Unrestricted()),
    CENTRAL_2(new IdentificationFormat.Unrestricted()),
    LOCAL(new IdentificationFormat.Unrestricted()),
    LOCAL_1(new IdentificationFormat.Unrestricted()),
    LOCAL_2(new IdentificationFormat.Unrestricted()),
    PHONE_NUMBER(new IdentificationFormat.PhoneNumber()),
    KEY_CODE(new IdentificationFormat.Unrestricted());

    private final IdentificationFormat format;

    IdentificationType(IdentificationFormat format) {
        this.format = format;
    }

    public IdentificationFormat format() {
        return format;
    }

    public String code() {
        return name();
    }

    public static Optional<IdentificationType> fromCode(String code) {
        for (IdentificationType type : values()) {
            if (type.name().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
