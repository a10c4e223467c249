package com.questrail.ocmf.compliance;

import com.questrail.ocmf.OcmfFixtures;
import com.questrail.ocmf.codec.impl.DefaultOcmfDecoder;
import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.MeterStatus;
import com.questrail.ocmf.model.Ocmf;
import com.questrail.ocmf.model.OcmfUnit;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Reading;
import com.questrail.ocmf.model.Signature;
import com.questrail.ocmf.model.UserAssignmentStatus;
import com.questrail.ocmf.observability.OcmfComplianceEvent;
import com.questrail.ocmf.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EichrechtCheckerTest
 * -----------------------------------------------------------------------------
 * Starts from a compliant begin/end pair and breaks one property per test.
 */
final class EichrechtCheckerTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final EichrechtChecker checker = new EichrechtChecker(EichrechtPolicy.defaults(), sink);

    private static Set<IssueCode> codes(List<EichrechtIssue> issues)
    {
        return issues.stream().map(EichrechtIssue::code).collect(Collectors.toSet());
    }

    private static Ocmf record(Payload payload)
    {
        return new Ocmf(payload, Signature.ofHex("3006020101020101"), null);
    }

    private static Payload endWith(Reading reading)
    {
        return OcmfFixtures.endPayload().withReadings(List.of(reading)).buildUnvalidated();
    }

    private static Reading endReading()
    {
        return OcmfFixtures.endPayload().buildUnvalidated().readings().get(0);
    }

    @Test
    void compliantPairHasNoIssues()
    {
        List<EichrechtIssue> issues = checker.checkTransaction(
                OcmfFixtures.beginPayload().build(), OcmfFixtures.endPayload().build());
        assertTrue(issues.isEmpty(), issues::toString);

        OcmfComplianceEvent event = sink.eventsOfType(OcmfComplianceEvent.class).get(0);
        assertTrue(event.transactionPair());
        assertTrue(event.isCompliant());
    }

    @Test
    void meterStatusMustBeOk()
    {
        Reading r = endReading().toBuilder().withStatus(MeterStatus.MANIPULATED).build();
        List<EichrechtIssue> issues = checker.checkReading(r, false);

        assertEquals(1, issues.size());
        EichrechtIssue issue = issues.get(0);
        assertEquals(IssueCode.METER_STATUS, issue.code());
        assertEquals("ST", issue.field());
        assertTrue(issue.isError());
    }

    @Test
    void errorFlagsAreAnError()
    {
        Reading r = endReading().toBuilder().withErrorFlags("E").build();
        assertEquals(Set.of(IssueCode.ERROR_FLAGS), codes(checker.checkReading(r, false)));
    }

    @Test
    void unsynchronizedTimeIsOnlyAWarning()
    {
        Reading r = endReading().toBuilder().withTimestamp("2024-03-01T11:30:00,000+0100 U").build();
        List<EichrechtIssue> issues = checker.checkReading(r, false);

        assertEquals(1, issues.size());
        assertEquals(IssueCode.TIME_SYNC, issues.get(0).code());
        assertEquals(IssueSeverity.WARNING, issues.get(0).severity());
        assertTrue(EichrechtIssue.errorsOnly(issues).isEmpty());
    }

    @Test
    void cumulatedLossRules()
    {
        Reading negative = new Reading(endReading().timestamp(), MeterReadingReason.END, endReading().value(),
                endReading().identification(), OcmfUnit.KWH, null, new BigDecimal("-0.1"), null, MeterStatus.OK);
        assertEquals(Set.of(IssueCode.CL_NEGATIVE), codes(checker.checkReading(negative, false)));

        Reading nonZero = endReading().toBuilder().withCumulatedLoss("0.2").build();
        assertEquals(Set.of(IssueCode.CL_BEGIN), codes(checker.checkReading(nonZero, true)));
        assertTrue(checker.checkReading(nonZero, false).isEmpty());
    }

    @Test
    void missingReadingsShortCircuit()
    {
        Payload empty = OcmfFixtures.endPayload().withReadings(List.of()).buildUnvalidated();
        List<EichrechtIssue> issues = checker.checkTransaction(OcmfFixtures.beginPayload().build(), empty);

        assertEquals(1, issues.size());
        assertEquals(IssueCode.NO_READINGS, issues.get(0).code());
        assertEquals("Both begin and end payloads must contain readings (RD)", issues.get(0).message());
    }

    @Test
    void transactionTypesAreChecked()
    {
        Payload begin = OcmfFixtures.beginPayload().withReadings(List.of(
                OcmfFixtures.reading("2024-03-01T10:00:00,000+0100 S", MeterReadingReason.CHARGING, "100").build()))
                .buildUnvalidated();
        Payload end = endWith(endReading().toBuilder().withReason(MeterReadingReason.SUSPENDED).build());

        List<EichrechtIssue> issues = checker.checkTransaction(begin, end);
        assertTrue(codes(issues).containsAll(Set.of(IssueCode.BEGIN_TX, IssueCode.END_TX)));
        assertEquals("RD[0].TX", issues.stream().filter(i -> i.code() == IssueCode.END_TX)
                .findFirst().orElseThrow().field());
    }

    @Test
    void endIsTheLastReadingOfTheEndRecord()
    {
        Payload end = OcmfFixtures.endPayload().withReadings(List.of(
                OcmfFixtures.reading("2024-03-01T11:00:00,000+0100 S", MeterReadingReason.CHARGING, "105").build(),
                endReading())).buildUnvalidated();

        assertTrue(checker.checkTransaction(OcmfFixtures.beginPayload().build(), end).isEmpty());
    }

    @Test
    void valueMustNotDecrease()
    {
        Payload end = endWith(endReading().toBuilder().withValue("99.999").build());
        List<EichrechtIssue> issues = checker.checkTransaction(OcmfFixtures.beginPayload().build(), end);

        assertEquals(Set.of(IssueCode.VALUE_REGRESSION), codes(issues));
        assertEquals("RV", issues.get(0).field());
    }

    @Test
    void timeMustNotGoBackwards()
    {
        Payload end = endWith(endReading().toBuilder().withTimestamp("2024-03-01T09:59:59,000+0100 S").build());
        assertEquals(Set.of(IssueCode.TIME_REGRESSION),
                codes(checker.checkTransaction(OcmfFixtures.beginPayload().build(), end)));
    }

    @Test
    void sameInstantInOtherOffsetIsNotARegression()
    {
        Payload end = endWith(endReading().toBuilder().withTimestamp("2024-03-01T09:00:00,000+0000 S").build());
        assertTrue(checker.checkTransaction(OcmfFixtures.beginPayload().build(), end).isEmpty());
    }

    @Test
    void serialObisAndUnitMustMatch()
    {
        Payload end = OcmfFixtures.endPayload()
                .withGatewaySerial("GW-999")
                .withReadings(List.of(endReading().toBuilder()
                        .withIdentification("01-00:B3.08.00*FF")
                        .withUnit(OcmfUnit.WH)
                        .withValue("112500")
                        .build()))
                .buildUnvalidated();

        List<EichrechtIssue> issues = checker.checkTransaction(OcmfFixtures.beginPayload().build(), end);
        assertEquals(Set.of(IssueCode.SERIAL_MISMATCH, IssueCode.OBIS_MISMATCH, IssueCode.UNIT_MISMATCH), codes(issues));
        assertTrue(issues.stream().anyMatch(i -> "GS/MS".equals(i.field())));
    }

    @Test
    void meterSerialIsComparedWhenGatewaySerialIsAbsent()
    {
        Payload begin = OcmfFixtures.beginPayload().withGatewaySerial(null).build();
        Payload end = OcmfFixtures.endPayload().withGatewaySerial(null).withMeterSerial("MTR-002").build();

        assertEquals(Set.of(IssueCode.SERIAL_MISMATCH), codes(checker.checkTransaction(begin, end)));
    }

    @Test
    void identificationLevelErrorsAreReported()
    {
        Payload end = OcmfFixtures.endPayload()
                .withIdentificationLevel(UserAssignmentStatus.CERT_EXPIRED)
                .buildUnvalidated();

        List<EichrechtIssue> issues = checker.checkTransaction(OcmfFixtures.beginPayload().build(), end);
        assertEquals(Set.of(IssueCode.ID_LEVEL_INVALID), codes(issues));
        assertTrue(issues.get(0).message().contains("OUTDATED"));
        assertTrue(issues.get(0).message().contains("end"));
    }

    @Test
    void paginationMustBeConsecutive()
    {
        Payload begin = OcmfFixtures.beginPayload().withPagination("T3").build();
        Payload end = OcmfFixtures.endPayload().withPagination("T4").build();
        assertFalse(EichrechtIssue.hasErrors(checker.checkTransaction(begin, end)));

        Payload gap = OcmfFixtures.endPayload().withPagination("T5").build();
        assertEquals(Set.of(IssueCode.PAGINATION_INCONSISTENT),
                codes(checker.checkTransaction(OcmfFixtures.beginPayload().build(), gap)));
    }

    @Test
    void identificationMismatchSeverityFollowsPolicy()
    {
        Payload begin = OcmfFixtures.beginPayload().withIdentificationData("TAG-1").buildUnvalidated();
        Payload end = OcmfFixtures.endPayload().withIdentificationData("TAG-2").buildUnvalidated();

        List<EichrechtIssue> lenient = checker.checkTransaction(begin, end);
        assertEquals(Set.of(IssueCode.ID_MISMATCH), codes(lenient));
        assertEquals(IssueSeverity.WARNING, lenient.get(0).severity());

        EichrechtChecker strict = new EichrechtChecker(
                EichrechtPolicy.builder().withIdMismatchSeverity(IssueSeverity.ERROR).build(), sink);
        assertTrue(strict.checkTransaction(begin, end).get(0).isError());
    }

    @Test
    void validateTransactionPairIgnoresWarnings()
    {
        Ocmf t3 = record(OcmfFixtures.beginPayload().withPagination("T3").withIdentificationData("A").buildUnvalidated());
        Ocmf t4 = record(OcmfFixtures.endPayload().withPagination("T4").withIdentificationData("B").buildUnvalidated());
        Ocmf t5 = record(OcmfFixtures.endPayload().withPagination("T5").buildUnvalidated());

        assertTrue(checker.validateTransactionPair(t3, t4));
        assertFalse(checker.validateTransactionPair(record(OcmfFixtures.beginPayload().build()), t5));
    }

    @Test
    void singleRecordChecks()
    {
        Ocmf keba = new DefaultOcmfDecoder().decode(OcmfFixtures.KEBA_RECORD).orElseThrow();

        List<EichrechtIssue> all = checker.checkCompliance(keba, null, false);
        assertEquals(2, all.size());
        assertTrue(all.stream().allMatch(i -> i.code() == IssueCode.TIME_SYNC));
        assertTrue(checker.checkCompliance(keba, null, true).isEmpty());
        assertTrue(checker.isCompliant(keba));

        OcmfComplianceEvent event = sink.eventsOfType(OcmfComplianceEvent.class).get(0);
        assertFalse(event.transactionPair());
        assertEquals(2, event.warningCount());
    }

    @Test
    void recordWithoutReadings()
    {
        Payload empty = OcmfFixtures.beginPayload().withReadings(List.of()).buildUnvalidated();
        List<EichrechtIssue> issues = checker.checkRecord(empty);

        assertEquals(Set.of(IssueCode.NO_READINGS), codes(issues));
        assertEquals("No readings (RD) present in payload", issues.get(0).message());
        assertFalse(checker.isCompliant(record(empty)));
    }

    @Test
    void recordLevelBeginLossCheckAppliesToFirstReadingOnly()
    {
        Reading begin = new Reading(endReading().timestamp(), MeterReadingReason.BEGIN, endReading().value(),
                endReading().identification(), OcmfUnit.KWH, null, new BigDecimal("0.3"), null, MeterStatus.OK);
        Payload p = OcmfFixtures.beginPayload().withReadings(List.of(begin)).buildUnvalidated();

        assertEquals(Set.of(IssueCode.CL_BEGIN), codes(checker.checkRecord(p)));
    }

    @Test
    void checkComplianceWithOtherRecordChecksThePair()
    {
        Ocmf begin = record(OcmfFixtures.beginPayload().build());
        Ocmf end = record(endWith(endReading().toBuilder().withValue("1").build()));

        assertEquals(Set.of(IssueCode.VALUE_REGRESSION), codes(checker.checkCompliance(begin, end, false)));
    }
}
