package com.motionindex.shared.exception;

/**
 * A batch request was malformed and no job was created.
 */
public class BatchValidationException extends RuntimeException {

    public BatchValidationException(String message) {
        super(message);
    }
}
