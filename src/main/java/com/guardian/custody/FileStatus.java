package com.guardian.custody;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileStatus {
    PASS("pass"),
    FAIL("fail");

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
