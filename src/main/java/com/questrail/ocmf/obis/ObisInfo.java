package com.questrail.ocmf.obis;

import java.util.Objects;

/**
 * Registry entry describing a known OBIS register.
 *
 * @param code            normalized code (no {@code *suffix})
 * @param description     human-readable register name
 * @param billingRelevant whether readings of this register may be used for invoicing
 * @param category        measurement category
 */
public record ObisInfo(
        String code,
        String description,
        boolean billingRelevant,
        ObisCategory category
)
{
    public ObisInfo {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(category, "category");
    }

    public boolean isAccumulationRegister() {
        return ObisRegistry.ACCUMULATION.matcher(code).matches();
    }

    public boolean isTransactionRegister() {
        return ObisRegistry.TRANSACTION.matcher(code).matches();
    }
}
