package com.motionindex.config;

import com.motionindex.api.search.SearchDocument;
import com.motionindex.processing.indexing.IndexingQueueProcessor;
import com.motionindex.processing.queue.QueueManager;
import com.motionindex.processing.queue.QueueSettings;
import com.motionindex.processing.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Registers the application's work queues with the {@link QueueManager} at startup.
 */
@Configuration
public class QueueConfig {

    private static final Logger logger = LoggerFactory.getLogger(QueueConfig.class);

    @Bean
    public WorkQueue<SearchDocument> indexingQueue(
            QueueManager queueManager,
            IndexingQueueProcessor processor,
            @Value("${queues.indexing.max-size:300}") int maxSize,
            @Value("${queues.indexing.workers:6}") int workers,
            @Value("${queues.indexing.timeout-seconds:30}") long timeoutSeconds,
            @Value("${queues.indexing.retry-attempts:3}") int retryAttempts,
            @Value("${queues.indexing.retry-delay-seconds:5}") long retryDelaySeconds) {
        QueueSettings settings = new QueueSettings(IndexingQueueProcessor.QUEUE_NAME, IndexingQueueProcessor.ITEM_TYPE,
                maxSize, workers, Duration.ofSeconds(timeoutSeconds), retryAttempts, Duration.ofSeconds(retryDelaySeconds));
        WorkQueue<SearchDocument> queue = queueManager.createQueue(settings, SearchDocument.class, processor);
        logger.info("Indexing queue registered: {}", settings);
        return queue;
    }
}
