package com.guardian.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Gateway operation that produced a ledger record. */
public enum Operation {
    CHECK("check"),
    ANSWER("answer"),
    VERIFY("verify");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Operation fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + raw));
    }
}
