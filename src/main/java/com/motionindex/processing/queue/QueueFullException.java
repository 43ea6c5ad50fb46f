package com.motionindex.processing.queue;

import com.motionindex.shared.exception.CapacityExceededException;

/**
 * Enqueue was rejected because the queue is at capacity.
 */
public class QueueFullException extends CapacityExceededException {

    private final String queueName;

    public QueueFullException(String queueName, int maxSize) {
        super("queue " + queueName + " is full (max size: " + maxSize + ")", maxSize);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
