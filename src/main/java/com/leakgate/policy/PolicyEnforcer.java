package com.leakgate.policy;

import com.leakgate.config.BudgetsConfig;
import com.leakgate.config.IsoTimestamps;
import com.leakgate.config.PolicyConfig;
import com.leakgate.config.Waiver;
import com.leakgate.model.Category;
import com.leakgate.model.EnrichedFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gates a batch of enriched findings on the policy: waivers first, then finding budgets on what
 * is left, then the per-finding risk ceiling.
 */
public class PolicyEnforcer {
    private static final Logger logger = LoggerFactory.getLogger(PolicyEnforcer.class);

    private static final String SEVERITY_HIGH = "high";

    private final PolicyConfig config;
    private final WaiverMatcher waiverMatcher;
    private final ZoneId zone;

    public PolicyEnforcer(PolicyConfig config) {
        this(config, Clock.system(IsoTimestamps.DEFAULT_ZONE));
    }

    public PolicyEnforcer(PolicyConfig config, Clock clock) {
        this.config = config;
        this.waiverMatcher = new WaiverMatcher(clock);
        this.zone = clock.getZone();
    }

    /** Zone applied to waiver expiries that carry no offset. */
    public ZoneId getZone() {
        return zone;
    }

    public PolicyResult enforce(List<EnrichedFinding> findings) {
        List<AppliedWaiver> waiversApplied = new ArrayList<>();
        List<EnrichedFinding> remaining = new ArrayList<>();

        for (EnrichedFinding finding : findings) {
            Optional<Waiver> waiver = waiverMatcher.findActive(config.getWaivers(), finding.getRule(), finding.getPath());
            if (waiver.isPresent()) {
                waiversApplied.add(new AppliedWaiver(finding.getFinding().key(), waiver.get()));
                logger.info("Waiver applied to {}:{} ({})", finding.getRule(), finding.getPath(), waiver.get().getReason());
            } else {
                remaining.add(finding);
            }
        }

        List<Violation> violations = new ArrayList<>();
        violations.addAll(checkBudgets(remaining));
        violations.addAll(checkRiskScores(remaining));

        boolean passed = violations.isEmpty();
        PolicySummary summary = new PolicySummary(
                findings.size(), remaining.size(), violations.size(), waiversApplied.size(), passed);

        logger.info("Policy {}: {} findings, {} after waivers, {} violations",
                passed ? "passed" : "failed", findings.size(), remaining.size(), violations.size());
        return new PolicyResult(passed, List.copyOf(violations), List.copyOf(waiversApplied), summary);
    }

    private List<Violation> checkBudgets(List<EnrichedFinding> findings) {
        List<Violation> violations = new ArrayList<>();
        BudgetsConfig budgets = config.getBudgets();

        Integer maxNew = budgets.getNewFindings();
        if (maxNew != null && findings.size() > maxNew) {
            violations.add(budgetViolation(
                    String.format("Found %d findings, but budget allows max %d", findings.size(), maxNew),
                    "new_findings", findings.size(), maxNew, null));
        }

        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (Category c : Category.values()) {
            counts.put(c, 0);
        }
        for (EnrichedFinding f : findings) {
            Category c = f.getCategory() == null ? Category.UNKNOWN : f.getCategory();
            counts.merge(c, 1, Integer::sum);
        }

        for (Category category : Category.values()) {
            Integer limit = budgets.limitFor(category);
            if (limit == null) continue;
            int found = counts.get(category);
            if (found > limit) {
                violations.add(budgetViolation(
                        String.format("Found %d %s findings, but budget allows max %d", found, category.wireName(), limit),
                        BudgetsConfig.keyFor(category), found, limit, category));
            }
        }
        return violations;
    }

    private List<Violation> checkRiskScores(List<EnrichedFinding> findings) {
        Integer maxRisk = config.getBudgets().getMaxRiskScore();
        if (maxRisk == null) return List.of();

        List<Violation> violations = new ArrayList<>();
        for (EnrichedFinding f : findings) {
            if (f.getRiskScore() > maxRisk) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("risk_score", f.getRiskScore());
                details.put("max_allowed", maxRisk);
                details.put("line", f.getFinding().getLine());
                violations.add(Violation.builder()
                        .type(ViolationType.RISK_SCORE_TOO_HIGH)
                        .message(String.format("Finding has risk score %d, exceeds limit %d", f.getRiskScore(), maxRisk))
                        .severity(SEVERITY_HIGH)
                        .findingId(f.getRule())
                        .path(f.getPath())
                        .details(details)
                        .build());
            }
        }
        return violations;
    }

    private static Violation budgetViolation(String message, String budgetKey, int found, int allowed, Category category) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("found", found);
        details.put("allowed", allowed);
        details.put("budget_type", budgetKey);
        if (category != null) {
            details.put("category", category.wireName());
        }
        return Violation.builder()
                .type(ViolationType.BUDGET_EXCEEDED)
                .message(message)
                .severity(SEVERITY_HIGH)
                .details(details)
                .build();
    }
}
