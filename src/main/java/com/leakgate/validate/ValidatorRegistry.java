package com.leakgate.validate;

import com.leakgate.validate.builtin.AwsAccessKeyValidator;
import com.leakgate.validate.builtin.AzureSasValidator;
import com.leakgate.validate.builtin.GcpServiceAccountKeyValidator;
import com.leakgate.validate.builtin.GitHubPatValidator;
import com.leakgate.validate.builtin.SlackWebhookFormatValidator;
import com.leakgate.validate.builtin.SlackWebhookLocalValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-keyed, insertion-ordered set of validators plus one rate-limit bucket per validator.
 * Built once at startup and handed to the pipeline.
 */
public class ValidatorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<String, Validator> validators = new LinkedHashMap<>();
    private final Map<String, TokenBucket> buckets = new LinkedHashMap<>();
    private final Clock clock;

    public ValidatorRegistry() {
        this(Clock.systemUTC());
    }

    public ValidatorRegistry(Clock clock) {
        this.clock = clock;
    }

    public static ValidatorRegistry withBuiltins() {
        return withBuiltins(Clock.systemUTC());
    }

    public static ValidatorRegistry withBuiltins(Clock clock) {
        ValidatorRegistry registry = new ValidatorRegistry(clock);
        registry.register(new SlackWebhookFormatValidator());
        registry.register(new SlackWebhookLocalValidator());
        registry.register(new GcpServiceAccountKeyValidator());
        registry.register(new AzureSasValidator());
        registry.register(new GitHubPatValidator());
        registry.register(new AwsAccessKeyValidator());
        return registry;
    }

    public synchronized ValidatorRegistry register(Validator validator) {
        String name = validator.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Validator name must not be empty: " + validator.getClass().getName());
        }
        if (validators.containsKey(name)) {
            throw new IllegalArgumentException("Validator " + name + " already registered");
        }
        validators.put(name, validator);
        buckets.put(name, new TokenBucket(validator.rateLimitQps(), clock));
        logger.debug("Registered validator {} (network={}, qps={})",
                name, validator.requiresNetwork(), validator.rateLimitQps());
        return this;
    }

    public synchronized List<Validator> getAll() {
        return new ArrayList<>(validators.values());
    }

    public synchronized TokenBucket getBucket(String validatorName) {
        TokenBucket bucket = buckets.get(validatorName);
        if (bucket == null) {
            throw new IllegalArgumentException("Unknown validator: " + validatorName);
        }
        return bucket;
    }

    public synchronized int size() {
        return validators.size();
    }
}
