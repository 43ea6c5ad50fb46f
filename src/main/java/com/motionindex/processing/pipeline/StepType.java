package com.motionindex.processing.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pipeline steps in execution order.
 */
public enum StepType {
    EXTRACT,
    CLASSIFY,
    STORE,
    INDEX;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
