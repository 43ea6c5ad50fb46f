package com.motionindex.processing.queue;

import com.motionindex.observability.DatadogMetricsServiceStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueManagerTest {

    private QueueManager queueManager;

    @BeforeEach
    void setUp() {
        queueManager = new QueueManager(new DatadogMetricsServiceStub(), 5);
    }

    @AfterEach
    void tearDown() {
        queueManager.stop(Duration.ofSeconds(2));
    }

    @Test
    void testDuplicateNameIsRejected() {
        queueManager.createQueue(WorkQueueTest.settings("indexing", 10, 1, Duration.ofSeconds(1), 0),
                String.class, item -> { });

        assertThatThrownBy(() -> queueManager.createQueue(
                WorkQueueTest.settings("indexing", 10, 1, Duration.ofSeconds(1), 0), String.class, item -> { }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void testGetQueueChecksNameAndPayloadType() {
        WorkQueue<String> created = queueManager.createQueue(
                WorkQueueTest.settings("text", 10, 1, Duration.ofSeconds(1), 0), String.class, item -> { });

        assertThat(queueManager.getQueue("text", String.class)).isSameAs(created);
        assertThat(queueManager.getQueue("text", CharSequence.class)).isSameAs(created);
        assertThatThrownBy(() -> queueManager.getQueue("missing", String.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> queueManager.getQueue("text", Integer.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("carries String");
    }

    @Test
    void testStatsAndListingAreSortedByName() {
        queueManager.createQueue(WorkQueueTest.settings("zeta", 25, 2, Duration.ofSeconds(1), 0),
                String.class, item -> { });
        queueManager.createQueue(WorkQueueTest.settings("alpha", 10, 1, Duration.ofSeconds(1), 0),
                String.class, item -> { });

        Map<String, QueueStats> stats = queueManager.getAllStats();

        assertThat(queueManager.listQueues()).containsExactly("alpha", "zeta");
        assertThat(stats.keySet()).containsExactly("alpha", "zeta");
        QueueStats zeta = stats.get("zeta");
        assertThat(zeta.getCapacity()).isEqualTo(25);
        assertThat(zeta.getWorkers()).isEqualTo(2);
        assertThat(zeta.getItemType()).isEqualTo("text");
        assertThat(zeta.isRunning()).isTrue();
        assertThat(queueManager.isHealthy()).isTrue();
    }

    @Test
    void testStoppedManagerIsUnhealthyAndRefusesNewQueues() {
        queueManager.createQueue(WorkQueueTest.settings("indexing", 10, 1, Duration.ofSeconds(1), 0),
                String.class, item -> { });

        queueManager.stop(Duration.ofSeconds(2));

        assertThat(queueManager.isHealthy()).isFalse();
        assertThatThrownBy(() -> queueManager.createQueue(
                WorkQueueTest.settings("late", 10, 1, Duration.ofSeconds(1), 0), String.class, item -> { }))
                .isInstanceOf(IllegalStateException.class);
    }
}
