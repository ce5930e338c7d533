package com.guardian.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum VerdictStatus {
    PASS("pass"),
    HALT("halt"),
    DEFER("defer");

    private final String value;

    VerdictStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VerdictStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown verdict status: " + raw));
    }
}
