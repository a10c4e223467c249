package com.questrail.ocmf.codec;

import com.questrail.ocmf.model.Ocmf;

/**
 * OcmfEncoder
 * -----------------------------------------------------------------------------
 * Text-level encoder for OCMF records.
 *
 * <p>The output is value-identical to the record but is <strong>not</strong>
 * guaranteed to be byte-identical to any string the record was decoded from.
 * It must never be used to regenerate the bytes a signature covers; use
 * {@link Ocmf#originalPayloadBytes()} for that.</p>
 */
public interface OcmfEncoder
{
    /**
     * Encodes a record as {@code OCMF|<payload>|<signature>} with compact JSON
     * sections and absent fields omitted.
     *
     * @param hex if {@code true}, the UTF-8 bytes of the result are hex-encoded
     */
    String encode(Ocmf record, boolean hex);

    default String encode(Ocmf record) {
        return encode(record, false);
    }
}
