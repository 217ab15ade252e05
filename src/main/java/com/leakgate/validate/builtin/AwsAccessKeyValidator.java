package com.leakgate.validate.builtin;

import com.leakgate.model.Finding;
import com.leakgate.redact.Redactor;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.Validator;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * AWS access key id check. STS GetCallerIdentity needs a SigV4 signature, which needs the secret
 * access key as well; with only the key id the best this can say is indeterminate.
 */
public class AwsAccessKeyValidator implements Validator {
    public static final String NAME = "aws_ak_live";

    private static final Pattern ACCESS_KEY_ID = Pattern.compile("^AKIA[0-9A-Z]{16}$");

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
        return rule.contains("aws") || match.startsWith("AKIA");
    }

    @Override
    public ValidationResult validate(Finding finding) {
        String keyId = finding.getMatch() == null ? "" : finding.getMatch().trim();
        if (!ACCESS_KEY_ID.matcher(keyId).matches()) {
            return ValidationResult.invalid(NAME, "Invalid AWS Access Key ID format");
        }
        return ValidationResult.indeterminate(NAME,
                "Valid AKIA format: " + Redactor.redact(keyId),
                "AWS Access Key ID format valid, but full validation requires secret key");
    }
}
