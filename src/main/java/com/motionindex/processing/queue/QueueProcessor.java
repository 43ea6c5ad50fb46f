package com.motionindex.processing.queue;

/**
 * Processing function bound to a queue. Throwing marks the attempt as failed.
 */
@FunctionalInterface
public interface QueueProcessor<T> {

    void process(QueueItem<T> item) throws Exception;
}
