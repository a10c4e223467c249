package com.questrail.ocmf.compliance;

import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Reading;
import com.questrail.ocmf.model.UserAssignmentStatus;
import com.questrail.ocmf.observability.NullObservabilitySink;
import com.questrail.ocmf.observability.OcmfComplianceEvent;
import com.questrail.ocmf.observability.OcmfObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * EichrechtChecker
 * -----------------------------------------------------------------------------
 * German calibration-law (Eichrecht) compliance checks over decoded records.
 *
 * <h2>Transaction pair</h2>
 * The billing-relevant readings are the <em>first</em> reading of the begin
 * record and the <em>last</em> reading of the end record. In order:
 * <ol>
 *   <li>both records have readings, otherwise {@link IssueCode#NO_READINGS} and stop</li>
 *   <li>begin reading has {@code TX=B}; end reading has an end-type {@code TX}</li>
 *   <li>reading checks on both (begin with {@code isBegin=true})</li>
 *   <li>serial number ({@code GS} or {@code MS}), {@code RI} and {@code RU} agree</li>
 *   <li>{@code RV} and {@code TM} do not go backwards</li>
 *   <li>{@code IL} is not an error state on either side</li>
 *   <li>pagination counters are consecutive</li>
 *   <li>{@code ID} agrees (severity from {@link EichrechtPolicy})</li>
 * </ol>
 *
 * <p>The checker never fails; it returns a possibly empty list of issues and
 * leaves pass/fail policy to the caller.</p>
 */
public final class EichrechtChecker
{
    private final EichrechtPolicy policy;
    private final OcmfObservabilitySink sink;

    public EichrechtChecker() {
        this(EichrechtPolicy.defaults(), NullObservabilitySink.INSTANCE);
    }

    public EichrechtChecker(EichrechtPolicy policy, OcmfObservabilitySink sink) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public EichrechtPolicy policy() {
        return policy;
    }

    /**
     * Checks a single reading.
     *
     * @param isBegin whether the reading opens a transaction ({@code CL} must then be 0)
     */
    public List<EichrechtIssue> checkReading(Reading reading, boolean isBegin) {
        Objects.requireNonNull(reading, "reading");
        return Collections.unmodifiableList(ReadingCompliance.check(reading, isBegin));
    }

    /**
     * Checks every reading of one record. The first reading counts as a begin
     * reading if it has {@code TX=B}.
     */
    public List<EichrechtIssue> checkRecord(Payload payload) {
        Objects.requireNonNull(payload, "payload");
        List<EichrechtIssue> issues = new ArrayList<>();
        List<Reading> readings = payload.readings();

        if (readings.isEmpty()) {
            issues.add(EichrechtIssue.error(IssueCode.NO_READINGS, "RD", "No readings (RD) present in payload"));
        }
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            issues.addAll(ReadingCompliance.check(reading, i == 0 && reading.isBegin()));
        }
        return publish(issues, false);
    }

    /**
     * Checks a begin/end pair of records forming one charging transaction.
     */
    public List<EichrechtIssue> checkTransaction(Payload begin, Payload end) {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        List<EichrechtIssue> issues = new ArrayList<>();

        // 1) Readings present
        if (begin.readings().isEmpty() || end.readings().isEmpty()) {
            issues.add(EichrechtIssue.error(IssueCode.NO_READINGS, "RD",
                    "Both begin and end payloads must contain readings (RD)"));
            return publish(issues, true);
        }

        // 2) Billing-relevant readings
        Reading beginReading = begin.firstReading().orElseThrow();
        Reading endReading = end.lastReading().orElseThrow();
        int endIndex = end.readings().size() - 1;

        // 3) Transaction types
        if (beginReading.reason() != MeterReadingReason.BEGIN) {
            issues.add(EichrechtIssue.error(IssueCode.BEGIN_TX, "RD[0].TX",
                    "Begin reading must have TX='B', got '" + code(beginReading.reason()) + "'"));
        }
        if (!endReading.isEnd()) {
            issues.add(EichrechtIssue.error(IssueCode.END_TX, "RD[" + endIndex + "].TX",
                    "'" + code(endReading.reason()) + "' is not a valid end reading type"));
        }

        // 4) Reading checks
        issues.addAll(ReadingCompliance.check(beginReading, true));
        issues.addAll(ReadingCompliance.check(endReading, false));

        // 5) Field consistency
        mismatch(begin.serialNumber().orElse(null), end.serialNumber().orElse(null),
                "GS/MS", IssueCode.SERIAL_MISMATCH, "Serial numbers", IssueSeverity.ERROR)
                .ifPresent(issues::add);
        mismatch(text(beginReading.identification()), text(endReading.identification()),
                "RI", IssueCode.OBIS_MISMATCH, "OBIS codes", IssueSeverity.ERROR)
                .ifPresent(issues::add);
        mismatch(beginReading.unit().code(), endReading.unit().code(),
                "RU", IssueCode.UNIT_MISMATCH, "Units", IssueSeverity.ERROR)
                .ifPresent(issues::add);

        // 6) Progression
        if (beginReading.value() != null && endReading.value() != null
                && endReading.value().compareTo(beginReading.value()) < 0) {
            issues.add(EichrechtIssue.error(IssueCode.VALUE_REGRESSION, "RV",
                    "End value (" + endReading.value().toPlainString() + ") must be >= begin value ("
                            + beginReading.value().toPlainString() + ")"));
        }
        if (endReading.timestamp().isBefore(beginReading.timestamp())) {
            issues.add(EichrechtIssue.error(IssueCode.TIME_REGRESSION, "TM",
                    "End timestamp (" + endReading.timestamp() + ") must be >= begin timestamp ("
                            + beginReading.timestamp() + ")"));
        }

        // 7) Identification level
        identificationLevel(begin, "begin").ifPresent(issues::add);
        identificationLevel(end, "end").ifPresent(issues::add);

        // 8) Pagination
        if (!begin.pagination().isFollowedBy(end.pagination())) {
            issues.add(EichrechtIssue.error(IssueCode.PAGINATION_INCONSISTENT, "PG",
                    "Pagination must be consecutive: begin='" + begin.pagination()
                            + "', end='" + end.pagination() + "'"));
        }

        // 9) Identification data
        mismatch(begin.identificationData(), end.identificationData(),
                "ID", IssueCode.ID_MISMATCH, "Identification data", policy.idMismatchSeverity())
                .ifPresent(issues::add);

        return publish(issues, true);
    }

    /**
     * Checks one record alone, or as the begin record of a transaction ending in {@code other}.
     *
     * @param other      end record, or {@code null} for a single-record check
     * @param errorsOnly drop warnings from the result
     */
    public List<EichrechtIssue> checkCompliance(Ocmf record, Ocmf other, boolean errorsOnly) {
        Objects.requireNonNull(record, "record");
        List<EichrechtIssue> issues = other == null
                ? checkRecord(record.payload())
                : checkTransaction(record.payload(), other.payload());
        return errorsOnly ? EichrechtIssue.errorsOnly(issues) : issues;
    }

    /**
     * {@code true} if a single record has no error-severity issue.
     */
    public boolean isCompliant(Ocmf record) {
        return checkCompliance(record, null, true).isEmpty();
    }

    /**
     * {@code true} if the pair has no error-severity issue; warnings are ignored.
     */
    public boolean validateTransactionPair(Ocmf begin, Ocmf end) {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        return !EichrechtIssue.hasErrors(checkTransaction(begin.payload(), end.payload()));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Optional<EichrechtIssue> mismatch(String beginValue, String endValue, String field,
                                                     IssueCode code, String description,
                                                     IssueSeverity severity) {
        if (Objects.equals(beginValue, endValue)) {
            return Optional.empty();
        }
        return Optional.of(new EichrechtIssue(code,
                description + " must match: begin='" + beginValue + "', end='" + endValue + "'",
                field, severity));
    }

    private static Optional<EichrechtIssue> identificationLevel(Payload payload, String context) {
        UserAssignmentStatus level = payload.identificationLevel();
        if (level == null || !level.isError()) {
            return Optional.empty();
        }
        return Optional.of(EichrechtIssue.error(IssueCode.ID_LEVEL_INVALID, "IL",
                "Identification level '" + level.code() + "' indicates error and is not acceptable for billing ("
                        + context + ")"));
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static String code(MeterReadingReason reason) {
        return reason == null ? "none" : reason.code();
    }

    private List<EichrechtIssue> publish(List<EichrechtIssue> issues, boolean transactionPair) {
        int errors = (int) issues.stream().filter(EichrechtIssue::isError).count();
        sink.onComplianceCheck(new OcmfComplianceEvent(Instant.now(), transactionPair,
                errors, issues.size() - errors));
        return Collections.unmodifiableList(issues);
    }
}
