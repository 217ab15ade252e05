package com.leakgate.validate.builtin;

import com.leakgate.model.Finding;
import com.leakgate.redact.Redactor;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.Validator;

import java.util.Locale;
import java.util.regex.Pattern;

/** Structural check of a Slack incoming-webhook URL. Local only. */
public class SlackWebhookFormatValidator implements Validator {
    public static final String NAME = "slack_webhook_format";

    static final Pattern WEBHOOK = Pattern.compile(
            "https://hooks\\.slack\\.com/services/([A-Z0-9]{9})/([A-Z0-9]{9})/([A-Za-z0-9]{24})");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double rateLimitQps() {
        return 10.0;
    }

    @Override
    public boolean requiresNetwork() {
        return false;
    }

    @Override
    public boolean appliesTo(Finding finding) {
        return isSlackCandidate(finding);
    }

    @Override
    public ValidationResult validate(Finding finding) {
        String match = finding.getMatch() == null ? "" : finding.getMatch();
        if (WEBHOOK.matcher(match).lookingAt()) {
            return ValidationResult.valid(NAME,
                    "Valid Slack webhook format: " + Redactor.redact(match),
                    "Matches Slack webhook URL pattern");
        }
        return ValidationResult.invalid(NAME, "Does not match Slack webhook format");
    }

    static boolean isSlackCandidate(Finding finding) {
        String rule = finding.getRule() == null ? "" : finding.getRule().toLowerCase(Locale.ROOT);
        String match = finding.getMatch() == null ? "" : finding.getMatch();
        return rule.contains("slack") || match.contains("hooks.slack.com");
    }
}
