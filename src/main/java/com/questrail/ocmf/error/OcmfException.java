package com.questrail.ocmf.error;

import java.util.Objects;

/**
 * Unchecked carrier for an {@link OcmfError}.
 *
 * <p>Library operations report expected failures through {@link OcmfResult};
 * this exception exists for callers that prefer {@link OcmfResult#orElseThrow()}.</p>
 */
public final class OcmfException extends RuntimeException
{
    private final transient OcmfError error;

    public OcmfException(OcmfError error) {
        super(Objects.requireNonNull(error, "error").toString(), error.throwable());
        this.error = error;
    }

    public OcmfError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }
}
