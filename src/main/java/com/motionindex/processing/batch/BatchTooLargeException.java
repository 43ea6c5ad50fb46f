package com.motionindex.processing.batch;

import com.motionindex.shared.exception.CapacityExceededException;

/**
 * A batch request carried more documents than a single job accepts.
 */
public class BatchTooLargeException extends CapacityExceededException {

    private final int requested;

    public BatchTooLargeException(int requested, int maxDocuments) {
        super("batch of " + requested + " documents exceeds the maximum of " + maxDocuments, maxDocuments);
        this.requested = requested;
    }

    public int getRequested() {
        return requested;
    }
}
