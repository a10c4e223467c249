package com.questrail.ocmf.validation;

import com.questrail.ocmf.error.OcmfError;

import java.util.Optional;

/**
 * One step of a validation pipeline.
 *
 * @param <T> type of the value under validation
 */
@FunctionalInterface
public interface ValidationRule<T>
{
    /**
     * @return the violation, or empty if {@code subject} satisfies this rule
     */
    Optional<OcmfError> check(T subject);
}
