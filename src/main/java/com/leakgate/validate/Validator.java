package com.leakgate.validate;

import com.leakgate.model.Finding;

/**
 * A pluggable credential check. Implementations are registered once in a
 * {@link ValidatorRegistry}; the {@link ValidationEngine} enforces the network kill switch and
 * rate limits before {@link #validate(Finding)} is ever reached.
 */
public interface Validator {

    /** Globally unique name. */
    String name();

    double rateLimitQps();

    boolean requiresNetwork();

    /**
     * Whether this validator knows how to judge the finding at all. Findings outside its scope
     * get an indeterminate slot without calling {@link #validate(Finding)}.
     */
    default boolean appliesTo(Finding finding) {
        return true;
    }

    ValidationResult validate(Finding finding);
}
