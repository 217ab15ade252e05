package com.leakgate.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A single located match produced by a detector. Immutable: every pipeline stage derives a new
 * object instead of mutating this one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {
    @JsonProperty("path")
    String path; // repo-relative file path

    @JsonProperty("rule")
    @JsonAlias("id")
    String rule; // detector rule, e.g. "github_pat"

    @JsonProperty("line")
    int line; // 1-based

    @JsonProperty("match")
    String match; // full sensitive text until redacted

    @JsonProperty("match_hint")
    String matchHint; // detector's short preview of the match, sensitive as well

    @JsonProperty("severity")
    String severity;

    @JsonProperty("meta")
    Map<String, Object> meta;

    @JsonProperty("history_age_days")
    Integer historyAgeDays;

    /** Identifier used in waiver bookkeeping and log lines: {@code rule:path}. */
    public String key() {
        return rule + ":" + path;
    }
}
