package com.questrail.ocmf.obis;

/**
 * Measurement category of a known OBIS register.
 */
public enum ObisCategory
{
    IMPORT,
    EXPORT,
    POWER,
    OTHER
}
