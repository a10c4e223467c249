package com.questrail.ocmf.compliance;

/**
 * Calibration-law (Eichrecht) issue codes.
 */
public enum IssueCode
{
    // Reading level
    METER_STATUS,
    ERROR_FLAGS,
    TIME_SYNC,
    CL_BEGIN,
    CL_NEGATIVE,

    // Transaction level
    NO_READINGS,
    BEGIN_TX,
    END_TX,
    SERIAL_MISMATCH,
    OBIS_MISMATCH,
    UNIT_MISMATCH,
    VALUE_REGRESSION,
    TIME_REGRESSION,
    ID_MISMATCH,
    ID_LEVEL_INVALID,
    PAGINATION_INCONSISTENT
}
