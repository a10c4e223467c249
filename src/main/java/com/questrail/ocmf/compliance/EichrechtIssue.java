package com.questrail.ocmf.compliance;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One calibration-law finding.
 *
 * @param code     classification
 * @param message  human-readable description with the offending values
 * @param field    OCMF field concerned, or {@code null}
 * @param severity {@link IssueSeverity#ERROR} unless stated otherwise
 */
public record EichrechtIssue(
        IssueCode code,
        String message,
        String field,
        IssueSeverity severity
)
{
    public EichrechtIssue {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
    }

    static EichrechtIssue error(IssueCode code, String field, String message) {
        return new EichrechtIssue(code, message, field, IssueSeverity.ERROR);
    }

    static EichrechtIssue warning(IssueCode code, String field, String message) {
        return new EichrechtIssue(code, message, field, IssueSeverity.WARNING);
    }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    /**
     * Drops every issue that is not an error.
     */
    public static List<EichrechtIssue> errorsOnly(List<EichrechtIssue> issues) {
        return issues.stream().filter(EichrechtIssue::isError).collect(Collectors.toUnmodifiableList());
    }

    public static boolean hasErrors(List<EichrechtIssue> issues) {
        return issues.stream().anyMatch(EichrechtIssue::isError);
    }

    @Override
    public String toString() {
        return (field != null ? "[" + field + "] " : "") + message + " (" + code + ")";
    }
}
