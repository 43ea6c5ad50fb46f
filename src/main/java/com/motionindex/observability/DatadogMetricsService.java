package com.motionindex.observability;

import com.motionindex.util.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed metrics, shipped to Datadog through the StatsD registry.
 * Only active when datadog.enabled=true.
 *
 * Metrics:
 * - motionindex.job.completed: Counter of finished batch jobs by terminal status
 * - motionindex.job.duration: Timer for batch job wall time
 * - motionindex.document.processed: Counter of batch documents by outcome
 * - motionindex.classification.latency: Timer per provider attempt
 * - motionindex.classification.failure: Counter per provider and error category
 * - motionindex.classification.fallback: Counter of provider hand-offs
 * - motionindex.index.bulk: Counter of documents written or rejected by bulk index calls
 * - motionindex.pipeline.step: Timer per pipeline step
 * - motionindex.queue.rejected / motionindex.queue.failed: queue backpressure and dead items
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsService implements DatadogMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsService.class);
    private static final String SERVICE_TAG = "motion-index";

    private final MeterRegistry meterRegistry;

    public DatadogMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        logger.info("Datadog metrics service initialized");
    }

    @Override
    public void recordJobCompleted(String status, long durationMs) {
        Counter.builder("motionindex.job.completed")
                .description("Batch jobs that reached a terminal status")
                .tag("service", SERVICE_TAG)
                .tag("status", Strings.safe(status))
                .register(meterRegistry)
                .increment();
        Timer.builder("motionindex.job.duration")
                .description("Batch job duration")
                .tag("service", SERVICE_TAG)
                .tag("status", Strings.safe(status))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded job completion: status={}, duration={}ms", status, durationMs);
    }

    @Override
    public void recordDocumentProcessed(String status) {
        Counter.builder("motionindex.document.processed")
                .tag("service", SERVICE_TAG)
                .tag("status", Strings.safe(status))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordClassificationAttempt(String provider, boolean success, long durationMs) {
        Timer.builder("motionindex.classification.latency")
                .description("Classification provider call latency")
                .tag("service", SERVICE_TAG)
                .tag("provider", Strings.safe(provider))
                .tag("success", String.valueOf(success))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordClassificationFailure(String provider, String errorCategory) {
        Counter.builder("motionindex.classification.failure")
                .tag("service", SERVICE_TAG)
                .tag("provider", Strings.safe(provider))
                .tag("error_category", Strings.safe(errorCategory))
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded classification failure: provider={}, category={}", provider, errorCategory);
    }

    @Override
    public void recordProviderFallback(String fromProvider, String toProvider) {
        Counter.builder("motionindex.classification.fallback")
                .tag("service", SERVICE_TAG)
                .tag("from", Strings.safe(fromProvider))
                .tag("to", Strings.safe(toProvider))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordBulkIndex(int indexedCount, int failedCount, long durationMs) {
        Counter.builder("motionindex.index.bulk")
                .tag("service", SERVICE_TAG)
                .tag("outcome", "indexed")
                .register(meterRegistry)
                .increment(indexedCount);
        Counter.builder("motionindex.index.bulk")
                .tag("service", SERVICE_TAG)
                .tag("outcome", "failed")
                .register(meterRegistry)
                .increment(failedCount);
        Timer.builder("motionindex.index.bulk.duration")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded bulk index: indexed={}, failed={}, duration={}ms", indexedCount, failedCount, durationMs);
    }

    @Override
    public void recordPipelineStep(String step, boolean success, long durationMs) {
        Timer.builder("motionindex.pipeline.step")
                .tag("service", SERVICE_TAG)
                .tag("step", Strings.safe(step))
                .tag("success", String.valueOf(success))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordQueueRejection(String queueName) {
        Counter.builder("motionindex.queue.rejected")
                .tag("service", SERVICE_TAG)
                .tag("queue", Strings.safe(queueName))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordQueueItemFailure(String queueName) {
        Counter.builder("motionindex.queue.failed")
                .tag("service", SERVICE_TAG)
                .tag("queue", Strings.safe(queueName))
                .register(meterRegistry)
                .increment();
    }
}
