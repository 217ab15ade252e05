package com.leakgate.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.leakgate.model.EnrichedFinding;
import com.leakgate.policy.PolicyResult;
import lombok.Value;

import java.util.List;

@Value
public class TriageResult {
    @JsonProperty("findings")
    List<EnrichedFinding> findings;

    @JsonProperty("policy")
    PolicyResult policyResult;
}
