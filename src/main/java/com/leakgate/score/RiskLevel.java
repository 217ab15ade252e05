package com.leakgate.score;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    CRITICAL(80),
    HIGH(60),
    MEDIUM(40),
    LOW(20),
    INFO(0);

    private final int threshold;

    RiskLevel(int threshold) {
        this.threshold = threshold;
    }

    public static RiskLevel of(int score) {
        for (RiskLevel level : values()) {
            if (score >= level.threshold) return level;
        }
        return INFO;
    }

    public int getThreshold() {
        return threshold;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
