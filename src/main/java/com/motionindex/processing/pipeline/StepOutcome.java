package com.motionindex.processing.pipeline;

import java.time.Instant;

/**
 * What happened to one pipeline step.
 */
public class StepOutcome {

    private final StepType step;
    private final boolean success;
    private final boolean skipped;
    private final long durationMs;
    private final String error;
    private final String skipReason;
    private final Instant timestamp;

    private StepOutcome(StepType step, boolean success, boolean skipped, long durationMs,
                        String error, String skipReason) {
        this.step = step;
        this.success = success;
        this.skipped = skipped;
        this.durationMs = durationMs;
        this.error = error;
        this.skipReason = skipReason;
        this.timestamp = Instant.now();
    }

    public static StepOutcome succeeded(StepType step, long durationMs) {
        return new StepOutcome(step, true, false, durationMs, null, null);
    }

    public static StepOutcome failed(StepType step, long durationMs, String error) {
        return new StepOutcome(step, false, false, durationMs, error, null);
    }

    public static StepOutcome skipped(StepType step, String reason) {
        return new StepOutcome(step, true, true, 0L, null, reason);
    }

    public StepType getStep() {
        return step;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getError() {
        return error;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
