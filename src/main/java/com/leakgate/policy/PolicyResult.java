package com.leakgate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/** Outcome of a policy run. {@code passed == false} must fail the CI job. */
@Value
public class PolicyResult {
    @JsonProperty("passed")
    boolean passed;

    @JsonProperty("violations")
    List<Violation> violations;

    @JsonProperty("waivers_applied")
    List<AppliedWaiver> waiversApplied;

    @JsonProperty("summary")
    PolicySummary summary;
}
