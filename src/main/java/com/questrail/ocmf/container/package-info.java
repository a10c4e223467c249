/**
 * Extraction of OCMF strings and public keys from the XML files exchanged
 * with transparency software.
 */
package com.questrail.ocmf.container;
