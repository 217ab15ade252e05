package com.leakgate.validate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one validator on one finding. Evidence is a hint for humans and must already be
 * redacted when the result leaves {@link ValidationEngine}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {
    @JsonProperty("state")
    ValidationState state;

    @JsonProperty("evidence")
    String evidence;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("validator_name")
    String validatorName;

    public static ValidationResult valid(String validator, String evidence, String reason) {
        return new ValidationResult(ValidationState.VALID, evidence, reason, validator);
    }

    public static ValidationResult invalid(String validator, String reason) {
        return new ValidationResult(ValidationState.INVALID, null, reason, validator);
    }

    public static ValidationResult indeterminate(String validator, String reason) {
        return new ValidationResult(ValidationState.INDETERMINATE, null, reason, validator);
    }

    public static ValidationResult indeterminate(String validator, String evidence, String reason) {
        return new ValidationResult(ValidationState.INDETERMINATE, evidence, reason, validator);
    }
}
