package com.leakgate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads and validates the policy YAML. Every problem surfaces as a {@link PolicyConfigException}
 * naming the absolute file path and the failing section.
 */
public class PolicyConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(PolicyConfigLoader.class);

    public static final String DEFAULT_POLICY_RESOURCE = "/default_policy.yaml";
    public static final List<String> REPO_POLICY_FILENAMES = List.of(".leakgate.yml", ".leakgate.yaml");

    private static final List<String> REQUIRED_SECTIONS = List.of("version", "validators", "budgets");
    private static final List<String> WAIVER_FIELDS = List.of("rule", "path", "expiry", "reason");
    private static final List<String> BUDGET_KEYS = List.of(
            "new_findings", "new_actual_findings", "new_expired_findings",
            "new_test_findings", "new_unknown_findings", "max_risk_score");

    private final ObjectMapper mapper;
    private final ZoneId zone;

    public PolicyConfigLoader() {
        this(IsoTimestamps.DEFAULT_ZONE);
    }

    public PolicyConfigLoader(ZoneId zone) {
        this.zone = zone;
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /** Zone applied to waiver expiries that carry no offset. */
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Strategy:
     * 1. Explicit path (must exist)
     * 2. .leakgate.yml / .leakgate.yaml at the repository root
     * 3. Built-in defaults
     */
    public PolicyConfig resolve(Path explicitPath, Path repoRoot) {
        if (explicitPath != null) {
            return load(explicitPath);
        }
        if (repoRoot != null) {
            for (String name : REPO_POLICY_FILENAMES) {
                Path candidate = repoRoot.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    return load(candidate);
                }
            }
        }
        logger.info("No policy file found. Using default policy.");
        return loadDefault();
    }

    public PolicyConfig load(Path configFile) {
        String absolute = configFile.toAbsolutePath().normalize().toString();
        if (!Files.isRegularFile(configFile)) {
            throw new PolicyConfigException("Policy config file not found", absolute, "file");
        }

        JsonNode root;
        try {
            root = mapper.readTree(configFile.toFile());
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to parse policy YAML: " + firstLine(e.getMessage()),
                    absolute, "file", e);
        }

        PolicyConfig config = bind(root, absolute);
        logger.info("Loaded policy: {}", absolute);
        return config;
    }

    public PolicyConfig loadDefault() {
        String location = "classpath:" + DEFAULT_POLICY_RESOURCE;
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_POLICY_RESOURCE)) {
            if (in == null) {
                throw new PolicyConfigException("Default policy resource is missing", location, "file");
            }
            return bind(mapper.readTree(in), location);
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to read default policy: " + firstLine(e.getMessage()),
                    location, "file", e);
        }
    }

    /** Writes the built-in policy template to {@code destination}, replacing any existing file. */
    public void extractDefault(Path destination) {
        String absolute = destination.toAbsolutePath().normalize().toString();
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_POLICY_RESOURCE)) {
            if (in == null) {
                throw new PolicyConfigException("Default policy resource is missing",
                        "classpath:" + DEFAULT_POLICY_RESOURCE, "file");
            }
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Default policy written to: {}", absolute);
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to write default policy: " + firstLine(e.getMessage()),
                    absolute, "file", e);
        }
    }

    private PolicyConfig bind(JsonNode root, String location) {
        validate(root, location);
        try {
            return mapper.treeToValue(root, PolicyConfig.class);
        } catch (IOException e) {
            throw new PolicyConfigException("Policy does not match the expected schema: " + firstLine(e.getMessage()),
                    location, "root", e);
        }
    }

    void validate(JsonNode root, String location) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new PolicyConfigException("Policy config is empty", location, "root");
        }
        if (!root.isObject()) {
            throw new PolicyConfigException("Policy config must be a mapping", location, "root");
        }
        for (String section : REQUIRED_SECTIONS) {
            if (!root.has(section) || root.get(section).isNull()) {
                throw new PolicyConfigException("Missing required section: " + section, location, section);
            }
        }

        JsonNode version = root.get("version");
        if (!version.isInt() || version.asInt() != PolicyConfig.SUPPORTED_VERSION) {
            throw new PolicyConfigException("Policy version must be " + PolicyConfig.SUPPORTED_VERSION,
                    location, "version");
        }

        validateValidators(root.get("validators"), location);
        validateBudgets(root.get("budgets"), location);

        JsonNode waivers = root.get("waivers");
        if (waivers != null && !waivers.isNull()) {
            validateWaivers(waivers, location);
        } else if (waivers != null) {
            ((ObjectNode) root).remove("waivers");
        }
    }

    private void validateValidators(JsonNode validators, String location) {
        if (!validators.isObject()) {
            throw new PolicyConfigException("validators section must be a mapping", location, "validators");
        }
        // Explicit nulls fall back to the defaults
        ((ObjectNode) validators).remove(List.of("allow_network", "global_qps").stream()
                .filter(k -> validators.has(k) && validators.get(k).isNull())
                .collect(Collectors.toList()));
        JsonNode allowNetwork = validators.get("allow_network");
        if (allowNetwork != null && !allowNetwork.isNull() && !allowNetwork.isBoolean()) {
            throw new PolicyConfigException("allow_network must be true or false", location,
                    "validators.allow_network");
        }
        JsonNode globalQps = validators.get("global_qps");
        if (globalQps != null && !globalQps.isNull() && (!globalQps.isNumber() || globalQps.asDouble() <= 0)) {
            throw new PolicyConfigException("global_qps must be a positive number", location,
                    "validators.global_qps");
        }
    }

    private void validateBudgets(JsonNode budgets, String location) {
        if (!budgets.isObject()) {
            throw new PolicyConfigException("budgets section must be a mapping", location, "budgets");
        }
        for (String key : BUDGET_KEYS) {
            JsonNode limit = budgets.get(key);
            if (limit == null || limit.isNull()) continue;
            if (!limit.isIntegralNumber() || limit.asLong() < 0 || !limit.canConvertToInt()) {
                throw new PolicyConfigException(key + " must be a non-negative integer", location, "budgets." + key);
            }
        }
    }

    private void validateWaivers(JsonNode waivers, String location) {
        if (!waivers.isArray()) {
            throw new PolicyConfigException("waivers section must be a list", location, "waivers");
        }
        for (int i = 0; i < waivers.size(); i++) {
            String section = "waivers[" + i + "]";
            JsonNode waiver = waivers.get(i);
            if (!waiver.isObject()) {
                throw new PolicyConfigException("Waiver must be a mapping", location, section);
            }
            for (String field : WAIVER_FIELDS) {
                JsonNode value = waiver.get(field);
                if (value == null || value.isNull() || value.asText().isBlank()) {
                    throw new PolicyConfigException("Waiver missing required field: " + field, location, section);
                }
            }
            String expiry = waiver.get("expiry").asText();
            try {
                IsoTimestamps.parse(expiry, zone);
            } catch (DateTimeParseException e) {
                throw new PolicyConfigException("Invalid expiry date format: " + expiry, location, section);
            }
        }
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown error";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
