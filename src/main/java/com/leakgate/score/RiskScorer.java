package com.leakgate.score;

import com.leakgate.model.Category;
import com.leakgate.model.Finding;
import com.leakgate.model.RepoContext;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.ValidationState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Multiplicative risk model. Base score by rule times five independent modifiers, each computed
 * from the original inputs, then rounded and clamped to [0, 100].
 */
public class RiskScorer {

    public static final int DEFAULT_BASE_SCORE = 50;

    private static final Map<String, Integer> BASE_SCORES = Map.of(
            "github_pat", 70,
            "aws_keypair", 80,
            "slack_webhook", 40,
            "private_key", 90,
            "api_key", 60,
            "password", 50,
            "database_url", 75,
            "jwt_token", 65);

    // Order matters: first keyword contained in the path wins
    private static final Map<String, Double> PATH_MODIFIERS = new LinkedHashMap<>();

    static {
        PATH_MODIFIERS.put("production", 1.2);
        PATH_MODIFIERS.put("prod", 1.2);
        PATH_MODIFIERS.put("deploy", 1.2);
        PATH_MODIFIERS.put("release", 1.2);
        PATH_MODIFIERS.put("config", 1.1);
        PATH_MODIFIERS.put("env", 1.1);
        PATH_MODIFIERS.put(".env", 1.2);
        PATH_MODIFIERS.put("test", 0.7);
        PATH_MODIFIERS.put("tests", 0.7);
        PATH_MODIFIERS.put("spec", 0.7);
        PATH_MODIFIERS.put("mock", 0.6);
        PATH_MODIFIERS.put("fixture", 0.6);
        PATH_MODIFIERS.put("example", 0.5);
        PATH_MODIFIERS.put("sample", 0.5);
        PATH_MODIFIERS.put("demo", 0.5);
        PATH_MODIFIERS.put("readme", 0.3);
        PATH_MODIFIERS.put("doc", 0.3);
        PATH_MODIFIERS.put("docs", 0.3);
    }

    public int score(Finding finding, List<ValidationResult> results, Category category, RepoContext repoContext) {
        return breakdown(finding, results, category, repoContext).getScore();
    }

    public RiskBreakdown breakdown(Finding finding, List<ValidationResult> results, Category category,
                                   RepoContext repoContext) {
        int base = baseScore(finding.getRule());
        double validation = validationModifier(results);
        double path = pathModifier(finding.getPath());
        double exposure = exposureModifier(repoContext);
        double history = historyModifier(finding.getHistoryAgeDays());
        double categoryMod = categoryModifier(category);

        double raw = base * validation * path * exposure * history * categoryMod;
        int score = (int) Math.max(0, Math.min(100, Math.round(raw)));

        return RiskBreakdown.builder()
                .score(score)
                .level(RiskLevel.of(score))
                .baseScore(base)
                .validationModifier(validation)
                .pathModifier(path)
                .exposureModifier(exposure)
                .historyModifier(history)
                .categoryModifier(categoryMod)
                .build();
    }

    static int baseScore(String rule) {
        if (rule == null) return DEFAULT_BASE_SCORE;
        return BASE_SCORES.getOrDefault(rule, DEFAULT_BASE_SCORE);
    }

    static double validationModifier(List<ValidationResult> results) {
        if (results == null || results.isEmpty()) return 1.0;
        boolean hasValid = results.stream().anyMatch(r -> r.getState() == ValidationState.VALID);
        boolean hasInvalid = results.stream().anyMatch(r -> r.getState() == ValidationState.INVALID);
        if (hasValid) return 1.3;
        if (hasInvalid) return 0.4;
        return 0.9;
    }

    static double pathModifier(String path) {
        if (path == null || path.isEmpty()) return 1.0;
        String lower = path.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> e : PATH_MODIFIERS.entrySet()) {
            if (lower.contains(e.getKey())) return e.getValue();
        }
        return 1.0;
    }

    static double exposureModifier(RepoContext context) {
        if (context == null) return 1.0;
        if (context.isPublicRepo()) return 1.2;
        if (context.isExternalContributors()) return 1.1;
        return 1.0;
    }

    static double historyModifier(Integer historyAgeDays) {
        if (historyAgeDays == null) return 1.0;
        if (historyAgeDays > 365) return 1.2;
        if (historyAgeDays > 90) return 1.1;
        return 1.0;
    }

    static double categoryModifier(Category category) {
        if (category == null) return 1.0;
        switch (category) {
            case ACTUAL: return 1.3;
            case EXPIRED: return 0.3;
            case TEST: return 0.2;
            default: return 1.0;
        }
    }
}
