package com.questrail.ocmf.model;

import java.util.Optional;

/**
 * Message digest named in the signature algorithm.
 */
public enum HashAlgorithm
{
    SHA256,
    SHA512;

    public static Optional<HashAlgorithm> fromCode(String code) {
        for (HashAlgorithm hash : values()) {
            if (hash.name().equals(code)) {
                return Optional.of(hash);
            }
        }
        return Optional.empty();
    }
}
