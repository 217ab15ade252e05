package com.leakgate.validate.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakgate.model.Finding;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.Validator;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Live GitHub token check against {@code GET /user}. A 200 proves the token, a 401 disproves it,
 * anything else (other statuses, timeouts, I/O failures) is indeterminate.
 */
public class GitHubPatValidator implements Validator {
    private static final Logger logger = LoggerFactory.getLogger(GitHubPatValidator.class);

    public static final String NAME = "github_pat_live";
    public static final String DEFAULT_API_BASE = "https://api.github.com";

    private static final List<String> TOKEN_PREFIXES = List.of("ghp_", "github_pat_", "ghs_", "gho_");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final String apiBase;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public GitHubPatValidator() {
        this(DEFAULT_API_BASE, defaultClient());
    }

    public GitHubPatValidator(String apiBase, OkHttpClient httpClient) {
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.httpClient = httpClient;
    }

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(TIMEOUT)
                .readTimeout(TIMEOUT)
                .callTimeout(TIMEOUT)
                .build();
    }

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
        return rule.contains("github") || hasTokenPrefix(finding.getMatch());
    }

    @Override
    public ValidationResult validate(Finding finding) {
        String token = finding.getMatch() == null ? "" : finding.getMatch().trim();
        if (!hasTokenPrefix(token)) {
            return ValidationResult.invalid(NAME, "Invalid GitHub PAT format");
        }

        Request request = new Request.Builder()
                .url(apiBase + "/user")
                .header("Authorization", "token " + token)
                .header("User-Agent", "LeakGate-Validator/1.0")
                .header("Accept", "application/vnd.github+json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            if (code == 200) {
                return ValidationResult.valid(NAME,
                        "Valid GitHub token for user: " + readLogin(response.body()),
                        "Token successfully authenticated with GitHub API");
            }
            if (code == 401) {
                return ValidationResult.invalid(NAME, "Token rejected by GitHub API (401 Unauthorized)");
            }
            return ValidationResult.indeterminate(NAME, "GitHub API error: " + code);
        } catch (IOException e) {
            logger.debug("GitHub validation call failed for {}:{}", finding.getPath(), finding.getLine());
            return ValidationResult.indeterminate(NAME, "Network error: " + e.getClass().getSimpleName());
        }
    }

    private String readLogin(ResponseBody body) throws IOException {
        if (body == null) return "unknown";
        JsonNode user = mapper.readTree(body.string());
        JsonNode login = user.get("login");
        return login != null && login.isTextual() ? login.asText() : "unknown";
    }

    private static boolean hasTokenPrefix(String token) {
        if (token == null) return false;
        String t = token.trim();
        return TOKEN_PREFIXES.stream().anyMatch(t::startsWith);
    }
}
