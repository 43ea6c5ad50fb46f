package com.motionindex.processing.queue;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of work in a {@link WorkQueue}. Handled by exactly one worker; the retry
 * count is only touched by that worker.
 */
public class QueueItem<T> {

    private final String id;
    private final String type;
    private final T payload;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private volatile int retryCount;
    private volatile int maxRetries;
    private volatile Instant processedAt;

    public QueueItem(String type, T payload) {
        this(type, payload, Collections.emptyMap());
    }

    public QueueItem(String type, T payload, Map<String, String> metadata) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.payload = payload;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.createdAt = Instant.now();
        this.maxRetries = -1;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public T getPayload() {
        return payload;
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    void incrementRetryCount() {
        retryCount++;
    }

    /**
     * Retry budget; negative until the queue applies its default on enqueue.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    void markProcessed() {
        this.processedAt = Instant.now();
    }
}
