/**
 * OCMF Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> for OCMF records:
 * the mapping between the wire string and the record model.</p>
 *
 * <h2>Wire grammar</h2>
 * <pre>
 *   "OCMF" "|" payload-json "|" signature-json
 * </pre>
 * <p>The whole string may additionally be hex-encoded (even number of hex
 * digits, any case).</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String
 *     → OcmfDecoder       (hex detection, section split, JSON mapping, validation)
 *       → Ocmf            (payload, signature, original payload text)
 *         → SignatureVerifier / EichrechtChecker
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The decoder keeps the payload section verbatim; the verifier consumes
 *       only that text.</li>
 *   <li>The encoder is value-faithful, not byte-faithful.</li>
 * </ul>
 */
package com.questrail.ocmf.codec;
