package com.motionindex.processing.indexing;

import com.motionindex.api.search.InMemorySearchIndexService;
import com.motionindex.api.search.SearchDocument;
import com.motionindex.observability.DatadogMetricsServiceStub;
import com.motionindex.processing.queue.QueueManager;
import com.motionindex.processing.queue.QueueSettings;
import com.motionindex.processing.queue.WorkQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class IndexingQueueProcessorTest {

    private final QueueManager queueManager = new QueueManager(new DatadogMetricsServiceStub(), 5);

    @AfterEach
    void tearDown() {
        queueManager.stop(Duration.ofSeconds(2));
    }

    @Test
    void testQueuedDocumentsReachTheIndex() throws Exception {
        InMemorySearchIndexService searchIndexService = new InMemorySearchIndexService();
        WorkQueue<SearchDocument> queue = queueManager.createQueue(
                new QueueSettings(IndexingQueueProcessor.QUEUE_NAME, IndexingQueueProcessor.ITEM_TYPE,
                        10, 2, Duration.ofSeconds(5), 1, Duration.ZERO),
                SearchDocument.class, new IndexingQueueProcessor(searchIndexService));

        queue.enqueue(new SearchDocument("doc-1", "MOTION FOR SUMMARY JUDGMENT"));
        queue.enqueue(new SearchDocument("doc-2", ""));

        long deadline = System.currentTimeMillis() + 5_000;
        while (queue.getStats().getProcessed() + queue.getStats().getFailed() < 2
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(searchIndexService.get("doc-1")).isPresent();
        assertThat(queue.getStats().getProcessed()).isEqualTo(1);
        // Empty text is rejected by the index on every attempt
        assertThat(queue.getStats().getFailed()).isEqualTo(1);
        assertThat(queue.getStats().getRetried()).isEqualTo(1);
    }
}
