/**
 * OCMF Codec Implementation
 * =============================================================================
 *
 * <p>Concrete decoder and encoder built on Jackson's tree model.</p>
 *
 * <h2>Decode pipeline</h2>
 * <pre>
 *   String
 *     → OcmfFraming.unwrap          (trim, hex auto-detection)
 *     → OcmfFraming.split           (three sections, "OCMF" header)
 *     → ReadingInheritance.apply    (TM, TX, RI, RU, RT, EF, ST carried forward)
 *     → PayloadMapper / SignatureMapper
 *     → PayloadValidator
 *     → Ocmf
 * </pre>
 *
 * <p>Every failure at this layer is reported as an {@code OcmfError};
 * nothing is recovered silently.</p>
 */
package com.questrail.ocmf.codec.impl;
