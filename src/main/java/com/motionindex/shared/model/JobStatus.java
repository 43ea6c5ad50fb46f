package com.motionindex.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Batch job lifecycle: queued, then running, then one of the terminal states.
 */
public enum JobStatus {
    QUEUED("queued"),
    RUNNING("running"),
    COMPLETED("completed"),
    PARTIAL_SUCCESS("partial_success"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }

    @Override
    public String toString() {
        return value;
    }
}
