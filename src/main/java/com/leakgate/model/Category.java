package com.leakgate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Category {
    ACTUAL,
    EXPIRED,
    TEST,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
