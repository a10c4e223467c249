package com.questrail.ocmf.codec;

import com.questrail.ocmf.error.OcmfResult;
import com.questrail.ocmf.model.Ocmf;

/**
 * OcmfDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for OCMF records.
 *
 * <p>This interface defines the inbound boundary between a raw OCMF string
 * (plain or hex-encoded) and a validated {@link Ocmf} record.</p>
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Detecting and removing whole-record hex encoding</li>
 *   <li>Splitting the {@code OCMF|payload|signature} sections</li>
 *   <li>Mapping each JSON section to its record type</li>
 *   <li>Running the payload validation pipeline</li>
 *   <li>Retaining the payload text exactly as received</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for verifying the
 * signature or judging calibration-law compliance.</p>
 */
public interface OcmfDecoder
{
    /**
     * Decodes one OCMF record.
     *
     * @param text {@code OCMF|...|...}, optionally hex-encoded, surrounding
     *             whitespace ignored
     * @return the record, or the first error encountered
     */
    OcmfResult<Ocmf> decode(String text);
}
