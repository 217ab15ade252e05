package com.leakgate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PolicySummary {
    @JsonProperty("total_findings")
    int totalFindings;

    @JsonProperty("filtered_findings")
    int filteredFindings; // after waivers

    @JsonProperty("violations")
    int violations;

    @JsonProperty("waivers_applied")
    int waiversApplied;

    @JsonProperty("passed")
    boolean passed;
}
