package com.motionindex.processing.batch;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Limits and deadlines of the batch job engine.
 */
@Component
public class BatchJobSettings {

    private final int maxDocuments;
    private final Duration callTimeout;
    private final int classificationTextOffset;
    private final int classificationTextWindow;
    private final Duration bulkIndexBaseTimeout;
    private final Duration bulkIndexPerDocumentTimeout;
    private final Duration bulkIndexMaxTimeout;

    @Autowired
    public BatchJobSettings(
            @Value("${batch.max-documents:1000}") int maxDocuments,
            @Value("${batch.call-timeout-seconds:60}") long callTimeoutSeconds,
            @Value("${batch.classification-text.offset:500}") int classificationTextOffset,
            @Value("${batch.classification-text.window:1000}") int classificationTextWindow,
            @Value("${batch.bulk-index.base-timeout-seconds:60}") long bulkIndexBaseTimeoutSeconds,
            @Value("${batch.bulk-index.per-document-timeout-ms:200}") long bulkIndexPerDocumentTimeoutMs,
            @Value("${batch.bulk-index.max-timeout-seconds:600}") long bulkIndexMaxTimeoutSeconds) {
        this(maxDocuments, Duration.ofSeconds(callTimeoutSeconds), classificationTextOffset, classificationTextWindow,
                Duration.ofSeconds(bulkIndexBaseTimeoutSeconds), Duration.ofMillis(bulkIndexPerDocumentTimeoutMs),
                Duration.ofSeconds(bulkIndexMaxTimeoutSeconds));
    }

    public BatchJobSettings(int maxDocuments, Duration callTimeout,
                            int classificationTextOffset, int classificationTextWindow,
                            Duration bulkIndexBaseTimeout, Duration bulkIndexPerDocumentTimeout,
                            Duration bulkIndexMaxTimeout) {
        if (maxDocuments <= 0) {
            throw new IllegalArgumentException("batch.max-documents must be positive");
        }
        this.maxDocuments = maxDocuments;
        this.callTimeout = callTimeout;
        this.classificationTextOffset = Math.max(0, classificationTextOffset);
        this.classificationTextWindow = Math.max(1, classificationTextWindow);
        this.bulkIndexBaseTimeout = bulkIndexBaseTimeout;
        this.bulkIndexPerDocumentTimeout = bulkIndexPerDocumentTimeout;
        this.bulkIndexMaxTimeout = bulkIndexMaxTimeout;
    }

    public static BatchJobSettings defaults() {
        return new BatchJobSettings(1000, Duration.ofSeconds(60), 500, 1000,
                Duration.ofSeconds(60), Duration.ofMillis(200), Duration.ofMinutes(10));
    }

    /**
     * Deadline for one bulk index call: the base timeout plus a per-document allowance, capped.
     */
    public Duration bulkIndexTimeout(int documentCount) {
        Duration timeout = bulkIndexBaseTimeout.plus(bulkIndexPerDocumentTimeout.multipliedBy(Math.max(0, documentCount)));
        return timeout.compareTo(bulkIndexMaxTimeout) > 0 ? bulkIndexMaxTimeout : timeout;
    }

    /**
     * Portion of a document's text sent for classification. Long documents skip their
     * opening boilerplate (caption, court header) and send a window from the body.
     */
    public String classificationText(String text) {
        if (text == null || text.length() <= classificationTextOffset) {
            return text;
        }
        int end = Math.min(text.length(), classificationTextOffset + classificationTextWindow);
        return text.substring(classificationTextOffset, end);
    }

    public int getMaxDocuments() {
        return maxDocuments;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public int getClassificationTextOffset() {
        return classificationTextOffset;
    }

    public int getClassificationTextWindow() {
        return classificationTextWindow;
    }
}
