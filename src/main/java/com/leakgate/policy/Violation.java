package com.leakgate.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Violation {
    @JsonProperty("type")
    ViolationType type;

    @JsonProperty("message")
    String message;

    @JsonProperty("severity")
    String severity;

    @JsonProperty("finding_id")
    String findingId;

    @JsonProperty("path")
    String path;

    @JsonProperty("details")
    Map<String, Object> details;
}
