package com.questrail.ocmf.container;

import java.util.Objects;
import java.util.Optional;

/**
 * An OCMF string found in a container, with the public key delivered next to it.
 *
 * @param ocmf      raw OCMF text, {@code OCMF|...|...}
 * @param publicKey hex or base64 key text, or {@code null}
 */
public record OcmfCandidate(String ocmf, String publicKey)
{
    public OcmfCandidate {
        Objects.requireNonNull(ocmf, "ocmf");
    }

    public Optional<String> publicKeyIfPresent() {
        return Optional.ofNullable(publicKey);
    }
}
