package com.motionindex;

import com.motionindex.api.search.InMemorySearchIndexService;
import com.motionindex.processing.batch.BatchJobService;
import com.motionindex.processing.classification.ClassificationService;
import com.motionindex.processing.queue.QueueManager;
import com.motionindex.shared.model.BatchDocument;
import com.motionindex.shared.model.BatchJob;
import com.motionindex.shared.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context with local storage, the in-memory index and no classification
 * providers, then runs a small batch through the real wiring.
 */
@SpringBootTest(properties = {
        "app.storage.local-dir=target/test-storage",
        "queues.indexing.retry-delay-seconds=0"
})
class MotionIndexApplicationTest {

    @Autowired
    private BatchJobService batchJobService;

    @Autowired
    private ClassificationService classificationService;

    @Autowired
    private InMemorySearchIndexService searchIndexService;

    @Autowired
    private QueueManager queueManager;

    @Test
    void testContextWiresQueuesAndServices() {
        assertThat(classificationService).isNotNull();
        assertThat(queueManager.listQueues()).containsExactly("indexing");
        assertThat(queueManager.isHealthy()).isTrue();
    }

    @Test
    void testSkipAiBatchRunsToCompletion() throws Exception {
        Map<String, Object> options = new HashMap<>();
        options.put(BatchJobService.OPTION_SKIP_AI, true);
        options.put(BatchJobService.OPTION_INDEX_DOCUMENT, "true");

        BatchJob started = batchJobService.startBatch(Arrays.asList(
                new BatchDocument("ctx-1", null, "NOTICE OF MOTION AND MOTION TO STRIKE"),
                new BatchDocument("ctx-2", null, "DECLARATION OF COUNSEL IN SUPPORT")), options);

        BatchJob finished = awaitFinished(started.getId());

        assertThat(finished.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished.getProgress().getSuccess()).isEqualTo(2);
        assertThat(finished.getProgress().getIndexed()).isEqualTo(2);
        assertThat(finished.getResults()).allMatch(result -> result.isIndexed() && result.getIndexError() == null);
        assertThat(searchIndexService.get("ctx-1")).isPresent();
        assertThat(batchJobService.getJobResults(started.getId()).getId()).isEqualTo(started.getId());
    }

    private BatchJob awaitFinished(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            BatchJob job = batchJobService.getJobStatus(jobId);
            if (job.getStatus().isTerminal() && job.isFinished()) {
                return job;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("job " + jobId + " did not finish within 10s");
    }
}
