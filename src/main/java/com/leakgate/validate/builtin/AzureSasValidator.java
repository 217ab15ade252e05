package com.leakgate.validate.builtin;

import com.leakgate.model.Finding;
import com.leakgate.redact.Redactor;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.Validator;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Azure Storage SAS URL check. A well-formed URL needs a HEAD request against the storage
 * account to prove anything, which is not implemented; it stays indeterminate.
 */
public class AzureSasValidator implements Validator {
    public static final String NAME = "azure_sas_live";

    private static final List<String> STORAGE_DOMAINS = List.of(
            ".blob.core.windows.net",
            ".queue.core.windows.net",
            ".table.core.windows.net",
            ".file.core.windows.net");
    private static final List<String> REQUIRED_PARAMS = List.of("sig", "se");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double rateLimitQps() {
        return 1.0;
    }

    @Override
    public boolean requiresNetwork() {
        return true;
    }

    @Override
    public boolean appliesTo(Finding finding) {
        String rule = finding.getRule() == null ? "" : finding.getRule().toLowerCase(Locale.ROOT);
        String match = finding.getMatch() == null ? "" : finding.getMatch();
        return rule.contains("azure") || rule.contains("sas") || match.contains(".core.windows.net");
    }

    @Override
    public ValidationResult validate(Finding finding) {
        String sasUrl = finding.getMatch() == null ? "" : finding.getMatch().trim();
        URI uri = parseSasUri(sasUrl);
        if (uri == null) {
            return ValidationResult.invalid(NAME, "Invalid Azure SAS token format");
        }
        return ValidationResult.indeterminate(NAME,
                "Azure SAS token format valid for host: " + Redactor.redact(uri.getHost()),
                "Format validation passed, live validation would require actual HEAD request");
    }

    private static URI parseSasUri(String candidate) {
        if (!candidate.contains("?")) return null;
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            return null;
        }
        if (!"https".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) return null;

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (STORAGE_DOMAINS.stream().noneMatch(host::endsWith)) return null;

        Set<String> params = queryParamNames(uri.getRawQuery());
        return params.containsAll(REQUIRED_PARAMS) ? uri : null;
    }

    static Set<String> queryParamNames(String rawQuery) {
        Set<String> names = new HashSet<>();
        if (rawQuery == null) return names;
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            // Blank values do not count as present
            if (eq > 0 && eq < pair.length() - 1) {
                names.add(pair.substring(0, eq));
            }
        }
        return names;
    }
}
