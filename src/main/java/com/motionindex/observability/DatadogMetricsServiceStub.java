package com.motionindex.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * No-op metrics used when Datadog is disabled (the default for local runs and tests).
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class DatadogMetricsServiceStub implements DatadogMetricsServiceInterface {

    @Override
    public void recordJobCompleted(String status, long durationMs) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordDocumentProcessed(String status) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordClassificationAttempt(String provider, boolean success, long durationMs) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordClassificationFailure(String provider, String errorCategory) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordProviderFallback(String fromProvider, String toProvider) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordBulkIndex(int indexedCount, int failedCount, long durationMs) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordPipelineStep(String step, boolean success, long durationMs) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordQueueRejection(String queueName) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordQueueItemFailure(String queueName) {
        // No-op when Datadog is disabled
    }
}
