package com.questrail.ocmf.compliance;

/**
 * Severity of a compliance issue. Only {@link #ERROR} makes a record or
 * transaction non-compliant.
 */
public enum IssueSeverity
{
    ERROR,
    WARNING
}
