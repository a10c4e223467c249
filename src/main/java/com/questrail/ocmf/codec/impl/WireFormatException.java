package com.questrail.ocmf.codec.impl;

import com.questrail.ocmf.error.OcmfError;

/**
 * Raised inside the codec when a section or field cannot be decoded.
 * Never escapes {@link DefaultOcmfDecoder}; it is converted into a failed
 * result there.
 */
final class WireFormatException extends Exception
{
    private final OcmfError error;

    WireFormatException(OcmfError error) {
        super(error.message());
        this.error = error;
    }

    OcmfError error() {
        return error;
    }
}
