package com.leakgate.policy;

import com.leakgate.config.BudgetsConfig;
import com.leakgate.config.IsoTimestamps;
import com.leakgate.config.PolicyConfig;
import com.leakgate.config.PolicyConfigLoader;
import com.leakgate.config.Waiver;
import com.leakgate.model.Category;
import com.leakgate.model.EnrichedFinding;
import com.leakgate.model.Finding;
import com.leakgate.score.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEnforcerTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

    private static EnrichedFinding enriched(String rule, String path, Category category, int risk) {
        return EnrichedFinding.builder()
                .finding(Finding.builder().rule(rule).path(path).line(10).match("****").build())
                .category(category)
                .confidence(0.5)
                .reasons(List.of())
                .riskScore(risk)
                .riskLevel(RiskLevel.of(risk))
                .validationResults(List.of())
                .build();
    }

    private static PolicyConfig policy(BudgetsConfig budgets, Waiver... waivers) {
        PolicyConfig config = new PolicyConfig();
        config.setBudgets(budgets);
        config.setWaivers(List.of(waivers));
        return config;
    }

    private static BudgetsConfig newFindings(Integer max) {
        BudgetsConfig budgets = new BudgetsConfig();
        budgets.setNewFindings(max);
        return budgets;
    }

    @Test
    void zeroBudgetFailsOnASingleFinding() {
        PolicyResult result = new PolicyEnforcer(policy(newFindings(0)), NOW)
                .enforce(List.of(enriched("api_key", "src/a.py", Category.UNKNOWN, 30)));

        assertFalse(result.isPassed());
        assertEquals(1, result.getViolations().size());
        Violation v = result.getViolations().get(0);
        assertEquals(ViolationType.BUDGET_EXCEEDED, v.getType());
        assertEquals("Found 1 findings, but budget allows max 0", v.getMessage());
        assertEquals("high", v.getSeverity());
        assertEquals(1, v.getDetails().get("found"));
        assertEquals(0, v.getDetails().get("allowed"));
        assertEquals("new_findings", v.getDetails().get("budget_type"));
    }

    @Test
    void generousBudgetPasses() {
        PolicyResult result = new PolicyEnforcer(policy(newFindings(5)), NOW)
                .enforce(List.of(enriched("api_key", "src/a.py", Category.UNKNOWN, 30)));

        assertTrue(result.isPassed());
        assertTrue(result.getViolations().isEmpty());
        assertTrue(result.getSummary().isPassed());
    }

    @Test
    void riskAboveCeilingIsReportedPerFinding() {
        BudgetsConfig budgets = new BudgetsConfig();
        budgets.setMaxRiskScore(40);

        PolicyResult result = new PolicyEnforcer(policy(budgets), NOW).enforce(List.of(
                enriched("github_pat", "production/config.py", Category.UNKNOWN, 84),
                enriched("api_key", "src/b.py", Category.UNKNOWN, 40)));

        assertFalse(result.isPassed());
        assertEquals(1, result.getViolations().size());
        Violation v = result.getViolations().get(0);
        assertEquals(ViolationType.RISK_SCORE_TOO_HIGH, v.getType());
        assertEquals("github_pat", v.getFindingId());
        assertEquals("production/config.py", v.getPath());
        assertEquals(84, v.getDetails().get("risk_score"));
    }

    @Test
    void categoryBudgetsAreCheckedInOrder() {
        BudgetsConfig budgets = new BudgetsConfig();
        budgets.setNewActualFindings(0);
        budgets.setNewTestFindings(1);
        budgets.setNewUnknownFindings(0);

        PolicyResult result = new PolicyEnforcer(policy(budgets), NOW).enforce(List.of(
                enriched("a", "x/1", Category.UNKNOWN, 10),
                enriched("b", "x/2", Category.ACTUAL, 10),
                enriched("c", "x/3", Category.TEST, 10),
                enriched("d", "x/4", Category.TEST, 10)));

        assertEquals(3, result.getViolations().size());
        assertEquals("new_actual_findings", result.getViolations().get(0).getDetails().get("budget_type"));
        assertEquals("new_test_findings", result.getViolations().get(1).getDetails().get("budget_type"));
        assertEquals("new_unknown_findings", result.getViolations().get(2).getDetails().get("budget_type"));
    }

    @Test
    void activeWaiverRemovesFindingFromEvaluation() {
        Waiver waiver = new Waiver("github_pat", "tests/*", "2030-01-01", "fixture token");

        PolicyResult result = new PolicyEnforcer(policy(newFindings(0), waiver), NOW)
                .enforce(List.of(enriched("github_pat", "tests/fixtures/t.txt", Category.TEST, 10)));

        assertTrue(result.isPassed());
        assertEquals(1, result.getWaiversApplied().size());
        assertEquals("github_pat:tests/fixtures/t.txt", result.getWaiversApplied().get(0).getFinding());
        assertSame(waiver, result.getWaiversApplied().get(0).getWaiver());
        assertEquals(1, result.getSummary().getTotalFindings());
        assertEquals(0, result.getSummary().getFilteredFindings());
    }

    @Test
    void expiredWaiverDoesNotSuppress() {
        Waiver waiver = new Waiver("github_pat", "tests/*", "2025-05-31", "fixture token");

        PolicyResult result = new PolicyEnforcer(policy(newFindings(0), waiver), NOW)
                .enforce(List.of(enriched("github_pat", "tests/fixtures/t.txt", Category.TEST, 10)));

        assertFalse(result.isPassed());
        assertTrue(result.getWaiversApplied().isEmpty());
    }

    @Test
    void unsetBudgetsAreUnconstrained() {
        PolicyResult result = new PolicyEnforcer(policy(new BudgetsConfig()), NOW).enforce(List.of(
                enriched("a", "x/1", Category.ACTUAL, 100),
                enriched("b", "x/2", Category.ACTUAL, 100)));

        assertTrue(result.isPassed());
        assertEquals(2, result.getSummary().getFilteredFindings());
    }

    @Test
    void defaultEnforcerAndLoaderReadZonelessExpiriesInTheSameZone() {
        assertEquals(IsoTimestamps.DEFAULT_ZONE, new PolicyEnforcer(new PolicyConfig()).getZone());
        assertEquals(IsoTimestamps.DEFAULT_ZONE, new PolicyConfigLoader().getZone());
    }

    @Test
    void zonelessExpiryIsReadInTheEnforcerZone() {
        Clock justBeforeMidnightUtc = Clock.fixed(Instant.parse("2025-06-01T23:30:00Z"), IsoTimestamps.DEFAULT_ZONE);
        Waiver waiver = new Waiver("github_pat", "*", "2025-06-02T00:00:00", "until midnight");

        PolicyResult result = new PolicyEnforcer(policy(newFindings(0), waiver), justBeforeMidnightUtc)
                .enforce(List.of(enriched("github_pat", "src/a.py", Category.UNKNOWN, 10)));

        assertTrue(result.isPassed());
        assertEquals(1, result.getWaiversApplied().size());
    }

    @Test
    void emptyBatchPasses() {
        PolicyResult result = new PolicyEnforcer(policy(newFindings(0)), NOW).enforce(List.of());

        assertTrue(result.isPassed());
        assertEquals(0, result.getSummary().getTotalFindings());
    }

    @Test
    void reportListsViolationsAndSummary() {
        PolicyResult failed = new PolicyEnforcer(policy(newFindings(0)), NOW)
                .enforce(List.of(enriched("api_key", "src/a.py", Category.UNKNOWN, 30)));

        String report = PolicyReportFormatter.format(failed);

        assertTrue(report.startsWith("[FAIL]"));
        assertTrue(report.contains("[HIGH] budget_exceeded: Found 1 findings, but budget allows max 0"));
        assertTrue(report.contains("Violations: 1"));

        String passed = PolicyReportFormatter.format(new PolicyEnforcer(policy(newFindings(5)), NOW)
                .enforce(List.of()));
        assertTrue(passed.startsWith("[PASS]"));
    }
}
