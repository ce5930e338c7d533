package com.guardian.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Phase {
    PRE("pre"),
    POST("post");

    private final String value;

    Phase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Phase fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + raw));
    }
}
