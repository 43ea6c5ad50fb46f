package com.motionindex.shared.exception;

/**
 * Work was rejected because a bounded resource (a queue, the batch size limit,
 * the job executor) is at its limit. Distinct from processing failures: the caller
 * may retry later or with less work.
 */
public class CapacityExceededException extends RuntimeException {

    private final int limit;

    public CapacityExceededException(String message, int limit) {
        super(message);
        this.limit = limit;
    }

    public CapacityExceededException(String message, int limit, Throwable cause) {
        super(message, cause);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
