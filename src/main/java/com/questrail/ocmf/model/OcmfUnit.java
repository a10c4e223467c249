package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Units permitted for reading values ({@code RU}) and loss compensation ({@code LU}).
 */
public enum OcmfUnit
{
    KWH("kWh", Dimension.ENERGY),
    WH("Wh", Dimension.ENERGY),
    MOHM("mOhm", Dimension.RESISTANCE),
    OHM("Ohm", Dimension.RESISTANCE),
    SEC("sec", Dimension.TIME),
    MIN("min", Dimension.TIME),
    H("h", Dimension.TIME);

    public enum Dimension
    {
        ENERGY,
        RESISTANCE,
        TIME
    }

    private final String code;
    private final Dimension dimension;

    OcmfUnit(String code, Dimension dimension) {
        this.code = code;
        this.dimension = dimension;
    }

    public String code() {
        return code;
    }

    public Dimension dimension() {
        return dimension;
    }

    public static Optional<OcmfUnit> fromCode(String code) {
        for (OcmfUnit unit : values()) {
            if (unit.code.equals(code)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
