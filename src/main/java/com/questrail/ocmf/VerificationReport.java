package com.questrail.ocmf;

import com.questrail.ocmf.compliance.EichrechtIssue;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link OcmfInspector#verify}: signature validity and compliance issues.
 *
 * @param signatureValid whether the signature verified against the key
 * @param issues         compliance issues, warnings included
 */
public record VerificationReport(boolean signatureValid, List<EichrechtIssue> issues)
{
    public VerificationReport {
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
    }

    /**
     * {@code true} if the signature is valid and no error-severity issue was found.
     */
    public boolean isAcceptable() {
        return signatureValid && !EichrechtIssue.hasErrors(issues);
    }
}
