package com.leakgate.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ViolationType {
    BUDGET_EXCEEDED,
    RISK_SCORE_TOO_HIGH,
    // Reserved for reporting; skipped or rate-limited validation is indeterminate, never a violation
    NETWORK_DISABLED,
    RATE_LIMIT_EXCEEDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
