package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Identification flags ({@code IF}), one constant per entry of OCMF tables 13-16.
 *
 * <p>Each flag belongs to exactly one {@link Source}. A record may not mix flags
 * from different sources unless every flag is a {@code *_NONE} sentinel.</p>
 */
public enum IdentificationFlag
{
    RFID_NONE(Source.RFID),
    RFID_PLAIN(Source.RFID),
    RFID_RELATED(Source.RFID),
    RFID_PSK(Source.RFID),

    OCPP_NONE(Source.OCPP),
    OCPP_RS(Source.OCPP),
    OCPP_AUTH(Source.OCPP),
    OCPP_RS_TLS(Source.OCPP),
    OCPP_AUTH_TLS(Source.OCPP),
    OCPP_CACHE(Source.OCPP),
    OCPP_WHITELIST(Source.OCPP),
    OCPP_CERTIFIED(Source.OCPP),

    ISO15118_NONE(Source.ISO15118),
    ISO15118_PNC(Source.ISO15118),

    PLMN_NONE(Source.PLMN),
    PLMN_RING(Source.PLMN),
    PLMN_SMS(Source.PLMN);

    /**
     * Identification method table a flag is drawn from.
     */
    public enum Source
    {
        RFID,
        OCPP,
        ISO15118,
        PLMN
    }

    private final Source source;

    IdentificationFlag(Source source) {
        this.source = source;
    }

    public Source source() {
        return source;
    }

    public String code() {
        return name();
    }

    /**
     * {@code true} for the sentinel that states no assignment happened via this source.
     */
    public boolean isNone() {
        return name().endsWith("_NONE");
    }

    public static Optional<IdentificationFlag> fromCode(String code) {
        for (IdentificationFlag flag : values()) {
            if (flag.name().equals(code)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
