package com.leakgate.validate.builtin;

import com.leakgate.model.Finding;
import com.leakgate.redact.Redactor;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.Validator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slack webhook check that also verifies the shape of each URL component: team id, channel or
 * bot id, and the 24 character token.
 */
public class SlackWebhookLocalValidator implements Validator {
    public static final String NAME = "slack_webhook_local";

    private static final Pattern TEAM_ID = Pattern.compile("^T[A-Z0-9]{8}$");
    private static final Pattern CHANNEL_ID = Pattern.compile("^[BC][A-Z0-9]{8}$");
    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9]{24}$");

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
        return SlackWebhookFormatValidator.isSlackCandidate(finding);
    }

    @Override
    public ValidationResult validate(Finding finding) {
        String match = finding.getMatch() == null ? "" : finding.getMatch();
        Matcher m = SlackWebhookFormatValidator.WEBHOOK.matcher(match);
        if (!m.lookingAt()) {
            return ValidationResult.invalid(NAME, "Does not match Slack webhook URL pattern");
        }

        String teamId = m.group(1);
        String channelId = m.group(2);
        String token = m.group(3);

        // Component values are never echoed back, only what was wrong with them
        List<String> issues = new ArrayList<>();
        if (!TEAM_ID.matcher(teamId).matches()) {
            issues.add("team ID must start with T");
        }
        if (!CHANNEL_ID.matcher(channelId).matches()) {
            issues.add("channel/bot ID must start with B or C");
        }
        if (!TOKEN.matcher(token).matches()) {
            issues.add("token length=" + token.length());
        }

        if (!issues.isEmpty()) {
            return ValidationResult.invalid(NAME, "Format validation failed: " + String.join("; ", issues));
        }

        return ValidationResult.valid(NAME,
                "Valid Slack webhook format with component checks: " + Redactor.redact(match),
                "Passed Slack webhook URL pattern and component validation");
    }
}
