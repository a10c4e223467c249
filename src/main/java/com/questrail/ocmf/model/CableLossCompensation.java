package com.questrail.ocmf.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Loss compensation parameters ({@code LC}).
 *
 * @param naming         {@code LN}, at most 20 characters, or {@code null}
 * @param identification {@code LI}, or {@code null}
 * @param resistance     {@code LR}, cable resistance
 * @param unit           {@code LU}, a resistance unit
 */
public record CableLossCompensation(
        String naming,
        Long identification,
        BigDecimal resistance,
        OcmfUnit unit
)
{
    public static final int MAX_NAMING_LENGTH = 20;

    public CableLossCompensation {
        Objects.requireNonNull(resistance, "resistance");
        Objects.requireNonNull(unit, "unit");
        if (unit.dimension() != OcmfUnit.Dimension.RESISTANCE) {
            throw new IllegalArgumentException("LU must be a resistance unit (was " + unit.code() + ")");
        }
        if (naming != null && naming.length() > MAX_NAMING_LENGTH) {
            throw new IllegalArgumentException(
                    "LN must be at most " + MAX_NAMING_LENGTH + " characters (was " + naming.length() + ")");
        }
    }
}
