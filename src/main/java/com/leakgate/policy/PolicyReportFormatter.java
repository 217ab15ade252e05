package com.leakgate.policy;

import java.util.ArrayList;
import java.util.List;

/** Plain-text rendering of a {@link PolicyResult} for the console. */
public final class PolicyReportFormatter {

    private PolicyReportFormatter() {
    }

    public static String format(PolicyResult result) {
        List<String> lines = new ArrayList<>();
        if (result.isPassed()) {
            lines.add("[PASS] All policy checks passed.");
        } else {
            lines.add("[FAIL] Policy violations found:");
            lines.add("");
            for (Violation v : result.getViolations()) {
                lines.add(String.format("[%s] %s: %s", v.getSeverity().toUpperCase(), v.getType().wireName(), v.getMessage()));
                if (v.getPath() != null && !v.getPath().isEmpty()) {
                    lines.add("   File: " + v.getPath());
                }
                if (v.getFindingId() != null && !v.getFindingId().isEmpty()) {
                    lines.add("   Rule: " + v.getFindingId());
                }
                lines.add("");
            }
        }

        PolicySummary summary = result.getSummary();
        lines.add("Summary:");
        lines.add("  Total findings: " + summary.getTotalFindings());
        lines.add("  After waivers: " + summary.getFilteredFindings());
        lines.add("  Violations: " + summary.getViolations());
        lines.add("  Waivers applied: " + summary.getWaiversApplied());
        return String.join(System.lineSeparator(), lines);
    }
}
