package com.leakgate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.leakgate.score.RiskLevel;
import com.leakgate.validate.ValidationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A finding after validation, classification and scoring. The wrapped {@link Finding} and all
 * validation results are already redacted when this object is built by the pipeline.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrichedFinding {
    @JsonProperty("finding")
    Finding finding;

    @JsonProperty("category")
    Category category;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("reasons")
    List<String> reasons;

    @JsonProperty("risk_score")
    int riskScore;

    @JsonProperty("risk_level")
    RiskLevel riskLevel;

    @JsonProperty("validated")
    ValidationResult validated;

    @JsonProperty("validation_results")
    List<ValidationResult> validationResults;

    @JsonIgnore
    public String getRule() {
        return finding.getRule();
    }

    @JsonIgnore
    public String getPath() {
        return finding.getPath();
    }
}
