package com.leakgate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.leakgate.config.Waiver;
import lombok.Value;

@Value
public class AppliedWaiver {
    @JsonProperty("finding")
    String finding; // rule:path

    @JsonProperty("waiver")
    Waiver waiver;
}
