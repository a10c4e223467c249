package com.questrail.ocmf.validation;

import com.questrail.ocmf.error.ErrorKind;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.error.OcmfException;
import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.MeterStatus;
import com.questrail.ocmf.model.OcmfTimestamp;
import com.questrail.ocmf.model.OcmfUnit;
import com.questrail.ocmf.model.Reading;
import com.questrail.ocmf.obis.ObisCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReadingValidatorTest
 * -----------------------------------------------------------------------------
 * Cross-field rules of a single reading, and the order in which they fire.
 */
final class ReadingValidatorTest
{
    private static final OcmfTimestamp TM = OcmfTimestamp.parse("2024-03-01T10:00:00,000+0100 S");

    private static Reading reading(MeterReadingReason tx, String value, String ri, String loss, String ef)
    {
        return new Reading(TM, tx,
                value == null ? null : new BigDecimal(value),
                ri == null ? null : ObisCode.parse(ri),
                OcmfUnit.KWH, null,
                loss == null ? null : new BigDecimal(loss),
                ef, MeterStatus.OK);
    }

    private static OcmfError violation(Reading r)
    {
        return ReadingValidator.validate(r).error().orElseThrow();
    }

    @Test
    void acceptsPlainBillingReading()
    {
        assertTrue(ReadingValidator.validate(
                reading(MeterReadingReason.END, "12.5", "01-00:B2.08.00*FF", "0.01", null)).isSuccess());
    }

    @Test
    void valueRequiredWithIdentification()
    {
        OcmfError e = violation(reading(MeterReadingReason.END, null, "01-00:B2.08.00*FF", null, null));
        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertEquals("RV", e.field());
    }

    @Test
    void unitWithoutIdentificationIsRejected()
    {
        OcmfError e = violation(reading(MeterReadingReason.END, "1", null, null, null));
        assertEquals("RI", e.field());
    }

    @Test
    void errorFlagsLimitedToKnownFlags()
    {
        assertTrue(ReadingValidator.validate(
                reading(MeterReadingReason.END, "1", "01-00:B2.08.00", null, "Et")).isSuccess());
        assertEquals("EF", violation(reading(MeterReadingReason.END, "1", "01-00:B2.08.00", null, "Ex")).field());
    }

    @Test
    void lossRequiresAccumulationRegister()
    {
        OcmfError e = violation(reading(MeterReadingReason.END, "1", "1-b:1.8.0", "0.5", null));
        assertEquals("CL", e.field());
        assertTrue(e.message().contains("accumulation register"));
    }

    @Test
    void lossMustBeZeroAtBegin()
    {
        assertTrue(ReadingValidator.validate(
                reading(MeterReadingReason.BEGIN, "1", "01-00:B2.08.00", "0", null)).isSuccess());

        OcmfError e = violation(reading(MeterReadingReason.BEGIN, "1", "01-00:B2.08.00", "0.2", null));
        assertEquals("CL", e.field());
        assertTrue(e.message().contains("TX=B"));
    }

    @Test
    void lossMustNotBeNegative()
    {
        OcmfError e = violation(reading(MeterReadingReason.END, "1", "01-00:B2.08.00", "-0.1", null));
        assertEquals("CL", e.field());
        assertTrue(e.message().contains("non-negative"));
    }

    @Test
    void builderRunsValidation()
    {
        OcmfException e = assertThrows(OcmfException.class, () -> Reading.builder()
                .withTimestamp(TM)
                .withReason(MeterReadingReason.BEGIN)
                .withValue("1")
                .withIdentification("01-00:B2.08.00")
                .withUnit(OcmfUnit.KWH)
                .withCumulatedLoss("0.3")
                .withStatus(MeterStatus.OK)
                .build());
        assertEquals(ErrorKind.VALIDATION, e.kind());
        assertEquals("CL", e.error().field());
    }
}
