package com.motionindex.observability;

/**
 * Metrics emitted by the pipeline, batch engine, classifier chain and queues.
 * Backed by Micrometer when Datadog is enabled, a no-op otherwise.
 */
public interface DatadogMetricsServiceInterface {
    void recordJobCompleted(String status, long durationMs);
    void recordDocumentProcessed(String status);
    void recordClassificationAttempt(String provider, boolean success, long durationMs);
    void recordClassificationFailure(String provider, String errorCategory);
    void recordProviderFallback(String fromProvider, String toProvider);
    void recordBulkIndex(int indexedCount, int failedCount, long durationMs);
    void recordPipelineStep(String step, boolean success, long durationMs);
    void recordQueueRejection(String queueName);
    void recordQueueItemFailure(String queueName);
}
