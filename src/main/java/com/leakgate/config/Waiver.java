package com.leakgate.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneId;

/** Time-boxed exemption of one rule on a path glob. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Waiver {
    @JsonProperty("rule")
    private String rule;

    @JsonProperty("path")
    private String path; // glob

    @JsonProperty("expiry")
    private String expiry; // ISO-8601 date or date-time

    @JsonProperty("reason")
    private String reason;

    /**
     * Expiry as an instant. Values without an offset are read in {@code zone}.
     *
     * @throws java.time.format.DateTimeParseException if the expiry is not ISO-8601
     */
    @JsonIgnore
    public Instant expiresAt(ZoneId zone) {
        return IsoTimestamps.parse(expiry, zone);
    }
}
