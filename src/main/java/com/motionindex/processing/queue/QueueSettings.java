package com.motionindex.processing.queue;

import java.time.Duration;

/**
 * Static configuration of one named work queue.
 */
public class QueueSettings {

    private final String name;
    private final String itemType;
    private final int maxSize;
    private final int workerCount;
    private final Duration processTimeout;
    private final int retryAttempts;
    private final Duration retryDelay;

    public QueueSettings(String name, String itemType, int maxSize, int workerCount,
                         Duration processTimeout, int retryAttempts, Duration retryDelay) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("queue name is required");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("queue " + name + ": maxSize must be positive");
        }
        if (workerCount <= 0) {
            throw new IllegalArgumentException("queue " + name + ": workerCount must be positive");
        }
        if (processTimeout == null || processTimeout.isZero() || processTimeout.isNegative()) {
            throw new IllegalArgumentException("queue " + name + ": processTimeout must be positive");
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("queue " + name + ": retryAttempts must not be negative");
        }
        this.name = name;
        this.itemType = itemType;
        this.maxSize = maxSize;
        this.workerCount = workerCount;
        this.processTimeout = processTimeout;
        this.retryAttempts = retryAttempts;
        this.retryDelay = retryDelay != null ? retryDelay : Duration.ZERO;
    }

    public String getName() {
        return name;
    }

    public String getItemType() {
        return itemType;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getProcessTimeout() {
        return processTimeout;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    @Override
    public String toString() {
        return "QueueSettings{name=" + name + ", itemType=" + itemType + ", maxSize=" + maxSize
                + ", workers=" + workerCount + ", timeout=" + processTimeout + ", retries=" + retryAttempts
                + ", retryDelay=" + retryDelay + "}";
    }
}
