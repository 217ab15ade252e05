package com.leakgate.validate;

import com.leakgate.config.ValidatorsConfig;
import com.leakgate.model.Finding;
import com.leakgate.redact.Redactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered validator against a finding behind the network kill switch and the
 * global/per-validator rate limits. Never throws for a single validator's failure and always
 * returns one result per registered validator, in registry order.
 */
public class ValidationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    public static final String REASON_NETWORK_DISABLED = "network disabled - validator skipped";
    public static final String REASON_RATE_LIMITED = "rate limit exceeded";
    public static final String REASON_NOT_APPLICABLE = "not applicable to this finding";
    public static final String REASON_ERROR_PREFIX = "validation error: ";

    private final ValidatorRegistry registry;
    private final boolean allowNetwork;
    private final TokenBucket globalBucket;

    public ValidationEngine(ValidatorRegistry registry, ValidatorsConfig config) {
        this(registry, config, Clock.systemUTC());
    }

    public ValidationEngine(ValidatorRegistry registry, ValidatorsConfig config, Clock clock) {
        this.registry = registry;
        this.allowNetwork = config.isAllowNetwork();
        this.globalBucket = new TokenBucket(config.getGlobalQps(), clock);
    }

    public List<ValidationResult> run(Finding finding) {
        List<ValidationResult> results = new ArrayList<>();
        for (Validator validator : registry.getAll()) {
            results.add(runOne(validator, finding));
        }
        return results;
    }

    private ValidationResult runOne(Validator validator, Finding finding) {
        String name = validator.name();

        // Kill switch comes first, before any other check can touch the validator
        if (validator.requiresNetwork() && !allowNetwork) {
            return ValidationResult.indeterminate(name, REASON_NETWORK_DISABLED);
        }

        try {
            if (!validator.appliesTo(finding)) {
                return ValidationResult.indeterminate(name, REASON_NOT_APPLICABLE);
            }
        } catch (RuntimeException e) {
            return failed(name, finding, e);
        }

        TokenBucket validatorBucket = registry.getBucket(name);
        if (!globalBucket.tryAcquire() || !validatorBucket.tryAcquire()) {
            logger.debug("Rate limit hit for validator {} on {}:{}", name, finding.getPath(), finding.getLine());
            return ValidationResult.indeterminate(name, REASON_RATE_LIMITED);
        }

        ValidationResult result;
        try {
            result = validator.validate(finding);
        } catch (RuntimeException e) {
            return failed(name, finding, e);
        }

        if (result == null) {
            return ValidationResult.indeterminate(name, REASON_ERROR_PREFIX + "validator returned no result");
        }
        return Redactor.redactResult(result.toBuilder().validatorName(name).build());
    }

    private ValidationResult failed(String name, Finding finding, RuntimeException e) {
        String message = Redactor.redactEvidence(String.valueOf(e.getMessage()));
        logger.warn("Validator {} failed on {}:{}: {}", name, finding.getPath(), finding.getLine(), message);
        return ValidationResult.indeterminate(name, REASON_ERROR_PREFIX + message);
    }

    public boolean isNetworkAllowed() {
        return allowNetwork;
    }
}
