package com.questrail.ocmf.validation;

import com.questrail.ocmf.OcmfFixtures;
import com.questrail.ocmf.error.OcmfError;
import com.questrail.ocmf.model.IdentificationFlag;
import com.questrail.ocmf.model.IdentificationType;
import com.questrail.ocmf.model.MeterReadingReason;
import com.questrail.ocmf.model.MeterStatus;
import com.questrail.ocmf.model.OcmfTimestamp;
import com.questrail.ocmf.model.OcmfUnit;
import com.questrail.ocmf.model.Payload;
import com.questrail.ocmf.model.Reading;
import com.questrail.ocmf.obis.ObisCode;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PayloadValidatorTest
{
    private final PayloadValidator validator = PayloadValidator.defaults();

    private OcmfError violation(Payload p)
    {
        return validator.validate(p).error().orElseThrow();
    }

    @Test
    void acceptsCompliantPayload()
    {
        assertTrue(validator.validate(OcmfFixtures.beginPayload().buildUnvalidated()).isSuccess());
    }

    @Test
    void requiresGatewayOrMeterSerial()
    {
        Payload p = OcmfFixtures.beginPayload().withGatewaySerial(null).withMeterSerial("").buildUnvalidated();
        OcmfError e = violation(p);
        assertEquals("GS/MS", e.field());
        assertEquals("Either Gateway Serial (GS) or Meter Serial (MS) must be provided", e.message());
    }

    @Test
    void strictModeRequiresMeterSerial()
    {
        PayloadValidator strict = new PayloadValidator(
                OcmfValidationConfig.builder().withRequireMeterSerial(true).build());
        Payload gatewayOnly = OcmfFixtures.beginPayload().withMeterSerial(null).buildUnvalidated();

        assertTrue(validator.validate(gatewayOnly).isSuccess());
        assertEquals("MS", strict.validate(gatewayOnly).error().orElseThrow().field());
    }

    @Test
    void lengthLimits()
    {
        assertEquals("TT", violation(OcmfFixtures.beginPayload().withTariffText("x".repeat(251)).buildUnvalidated()).field());
        assertTrue(validator.validate(OcmfFixtures.beginPayload().withTariffText("x".repeat(250)).buildUnvalidated()).isSuccess());
        assertEquals("CF", violation(OcmfFixtures.beginPayload().withChargeControllerFirmware("v".repeat(26)).buildUnvalidated()).field());
    }

    @Test
    void readingErrorsCarryIndex()
    {
        Payload p = OcmfFixtures.beginPayload()
                .addReading(new Reading(
                        OcmfTimestamp.parse("2024-03-01T10:05:00,000+0100 S"),
                        MeterReadingReason.END, new BigDecimal("1"), ObisCode.parse("1-b:1.8.0"),
                        OcmfUnit.KWH, null, new BigDecimal("0.1"), null, MeterStatus.OK))
                .buildUnvalidated();
        OcmfError e = violation(p);
        assertEquals("RD[1].CL", e.field());
        assertTrue(e.message().startsWith("Reading 1: "));
    }

    @Test
    void identificationFlagsMustNotMixSources()
    {
        Payload mixed = OcmfFixtures.beginPayload()
                .withIdentificationFlags(List.of(IdentificationFlag.RFID_PLAIN, IdentificationFlag.OCPP_AUTH))
                .buildUnvalidated();
        OcmfError e = violation(mixed);
        assertEquals("IF", e.field());
        assertTrue(e.message().endsWith("Found: OCPP, RFID"));

        Payload noneSentinels = OcmfFixtures.beginPayload()
                .withIdentificationFlags(List.of(IdentificationFlag.RFID_NONE, IdentificationFlag.OCPP_NONE))
                .buildUnvalidated();
        assertTrue(validator.validate(noneSentinels).isSuccess());
    }

    @Test
    void identificationDataFollowsType()
    {
        assertEquals("ID", violation(OcmfFixtures.beginPayload()
                .withIdentificationType(IdentificationType.NONE)
                .withIdentificationData("ABC")
                .buildUnvalidated()).field());

        assertTrue(validator.validate(OcmfFixtures.beginPayload()
                .withIdentificationType(IdentificationType.ISO14443)
                .withIdentificationData("1F2E3D4C")
                .buildUnvalidated()).isSuccess());

        OcmfError e = violation(OcmfFixtures.beginPayload()
                .withIdentificationType(IdentificationType.ISO14443)
                .withIdentificationData("1F2E3D")
                .buildUnvalidated());
        assertEquals("ID", e.field());
        assertTrue(e.message().contains("ISO14443"));

        assertTrue(validator.validate(OcmfFixtures.beginPayload()
                .withIdentificationType(IdentificationType.PHONE_NUMBER)
                .withIdentificationData("+49 170 1234567")
                .buildUnvalidated()).isSuccess());
    }

    @Test
    void readingSequenceCheckCanBeDisabled()
    {
        Payload p = OcmfFixtures.endPayload()
                .addReading(OcmfFixtures.reading("2024-03-01T11:31:00,000+0100 S", MeterReadingReason.CHARGING, "112.6").build())
                .buildUnvalidated();

        assertEquals("RD[0].TX", violation(p).field());

        PayloadValidator lenient = new PayloadValidator(
                OcmfValidationConfig.builder().withEnforceReadingSequence(false).build());
        assertTrue(lenient.validate(p).isSuccess());
    }

    @Test
    void singleEndReadingPasses()
    {
        assertTrue(validator.validate(OcmfFixtures.endPayload().buildUnvalidated()).isSuccess());
    }
}
