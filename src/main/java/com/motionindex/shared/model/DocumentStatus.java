package com.motionindex.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentStatus {
    SUCCESS("success"),
    ERROR("error"),
    SKIPPED("skipped");

    private final String value;

    DocumentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
