package com.questrail.ocmf.compliance;

import com.questrail.ocmf.model.MeterStatus;
import com.questrail.ocmf.model.Reading;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Calibration-law checks on one billing-relevant reading.
 *
 * <ul>
 *   <li>{@code ST} other than {@code G}: {@link IssueCode#METER_STATUS} error</li>
 *   <li>{@code EF} not empty: {@link IssueCode#ERROR_FLAGS} error</li>
 *   <li>{@code TM} status other than {@code S}: {@link IssueCode#TIME_SYNC} warning</li>
 *   <li>{@code CL} not zero on a begin reading: {@link IssueCode#CL_BEGIN} error</li>
 *   <li>{@code CL} negative: {@link IssueCode#CL_NEGATIVE} error</li>
 * </ul>
 */
final class ReadingCompliance
{
    private ReadingCompliance() {}

    static List<EichrechtIssue> check(Reading reading, boolean isBegin) {
        List<EichrechtIssue> issues = new ArrayList<>();

        if (reading.status() != MeterStatus.OK) {
            issues.add(EichrechtIssue.error(IssueCode.METER_STATUS, "ST",
                    "Meter status must be 'G' (OK) for billing-relevant readings, got '"
                            + reading.status().code() + "' (" + reading.status() + ")"));
        }

        if (reading.errorFlags() != null && !reading.errorFlags().isBlank()) {
            issues.add(EichrechtIssue.error(IssueCode.ERROR_FLAGS, "EF",
                    "Error flags must be empty for billing-relevant readings, got '" + reading.errorFlags() + "'"));
        }

        if (!reading.timestamp().isSynchronized()) {
            issues.add(EichrechtIssue.warning(IssueCode.TIME_SYNC, "TM",
                    "Time should be synchronized (status 'S') for billing, got '"
                            + reading.timestamp().status().code() + "'"));
        }

        BigDecimal loss = reading.cumulatedLoss();
        if (loss != null) {
            if (isBegin && loss.signum() != 0) {
                issues.add(EichrechtIssue.error(IssueCode.CL_BEGIN, "CL",
                        "Cumulated loss (CL) must be 0 at transaction begin, got " + loss.toPlainString()));
            }
            if (loss.signum() < 0) {
                issues.add(EichrechtIssue.error(IssueCode.CL_NEGATIVE, "CL",
                        "Cumulated loss (CL) must be non-negative, got " + loss.toPlainString()));
            }
        }
        return issues;
    }
}
