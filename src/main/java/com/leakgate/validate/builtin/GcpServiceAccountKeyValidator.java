package com.leakgate.validate.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakgate.model.Finding;
import com.leakgate.redact.Redactor;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.Validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * GCP service account key check. The JSON key is checked for shape locally; proving it live
 * would mean signing a JWT with the private key and exchanging it for an access token, which is
 * not implemented, so a well-formed key stays indeterminate.
 */
public class GcpServiceAccountKeyValidator implements Validator {
    public static final String NAME = "gcp_sa_key_live";

    private static final List<String> REQUIRED_FIELDS =
            List.of("type", "project_id", "private_key_id", "private_key", "client_email");
    private static final Pattern CLIENT_EMAIL = Pattern.compile("^[^@]+@[^@]+\\.iam\\.gserviceaccount\\.com$");

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double rateLimitQps() {
        return 0.5;
    }

    @Override
    public boolean requiresNetwork() {
        return true;
    }

    @Override
    public boolean appliesTo(Finding finding) {
        String rule = finding.getRule() == null ? "" : finding.getRule().toLowerCase(Locale.ROOT);
        String match = finding.getMatch() == null ? "" : finding.getMatch();
        return rule.contains("gcp") || rule.contains("service_account") || match.contains("service_account");
    }

    @Override
    public ValidationResult validate(Finding finding) {
        String keyData = finding.getMatch() == null ? "" : finding.getMatch().trim();
        if (!keyData.startsWith("{")) {
            return ValidationResult.invalid(NAME, "Invalid GCP service account key format - expected JSON");
        }

        JsonNode key;
        try {
            key = mapper.readTree(keyData);
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid(NAME, "Invalid JSON format for GCP service account key");
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (!key.hasNonNull(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            return ValidationResult.invalid(NAME, "Missing required fields: " + String.join(", ", missing));
        }
        if (!"service_account".equals(key.get("type").asText())) {
            return ValidationResult.invalid(NAME, "Invalid key type - expected 'service_account'");
        }

        String clientEmail = key.get("client_email").asText();
        if (!CLIENT_EMAIL.matcher(clientEmail).matches()) {
            return ValidationResult.invalid(NAME, "Invalid service account email format");
        }

        return ValidationResult.indeterminate(NAME,
                "GCP service account key format valid: " + Redactor.redact(clientEmail),
                "Format validation passed, but live validation requires full OAuth2 implementation");
    }
}
