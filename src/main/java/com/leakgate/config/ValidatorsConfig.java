package com.leakgate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidatorsConfig {
    public static final double DEFAULT_GLOBAL_QPS = 2.0;

    // CI-safe default: live validators stay off unless a policy turns them on
    @JsonProperty("allow_network")
    private boolean allowNetwork = false;

    @JsonProperty("global_qps")
    private double globalQps = DEFAULT_GLOBAL_QPS;
}
