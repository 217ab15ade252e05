package com.leakgate.validate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationState {
    VALID,
    INVALID,
    INDETERMINATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
