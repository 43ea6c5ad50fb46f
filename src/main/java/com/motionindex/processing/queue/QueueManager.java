package com.motionindex.processing.queue;

import com.motionindex.observability.DatadogMetricsServiceInterface;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of named work queues. Queues are created at startup and
 * looked up by name by producers.
 */
@Component
public class QueueManager {

    private static final Logger logger = LoggerFactory.getLogger(QueueManager.class);

    private final Map<String, WorkQueue<?>> queues = new ConcurrentHashMap<>();
    private final DatadogMetricsServiceInterface metricsService;
    private final Duration shutdownGrace;
    private volatile boolean stopped;

    public QueueManager(DatadogMetricsServiceInterface metricsService,
                        @Value("${queues.shutdown-grace-seconds:30}") long shutdownGraceSeconds) {
        this.metricsService = metricsService;
        this.shutdownGrace = Duration.ofSeconds(shutdownGraceSeconds);
    }

    /**
     * Creates, registers and starts a queue.
     *
     * @throws IllegalArgumentException if a queue with that name already exists
     * @throws IllegalStateException    if the manager has been stopped
     */
    public synchronized <T> WorkQueue<T> createQueue(QueueSettings settings, Class<T> payloadType,
                                                     QueueProcessor<T> processor) {
        if (stopped) {
            throw new IllegalStateException("queue manager is stopped");
        }
        if (queues.containsKey(settings.getName())) {
            throw new IllegalArgumentException("queue " + settings.getName() + " already exists");
        }
        WorkQueue<T> queue = new WorkQueue<>(settings, payloadType, processor, metricsService);
        queue.start();
        queues.put(settings.getName(), queue);
        return queue;
    }

    /**
     * @throws IllegalArgumentException if no queue has that name or it carries another payload type
     */
    @SuppressWarnings("unchecked")
    public <T> WorkQueue<T> getQueue(String name, Class<T> payloadType) {
        WorkQueue<?> queue = queues.get(name);
        if (queue == null) {
            throw new IllegalArgumentException("queue " + name + " not found");
        }
        if (!payloadType.isAssignableFrom(queue.getPayloadType())) {
            throw new IllegalArgumentException("queue " + name + " carries " + queue.getPayloadType().getSimpleName()
                    + ", not " + payloadType.getSimpleName());
        }
        return (WorkQueue<T>) queue;
    }

    public List<String> listQueues() {
        List<String> names = new ArrayList<>(queues.keySet());
        Collections.sort(names);
        return names;
    }

    public Map<String, QueueStats> getAllStats() {
        Map<String, QueueStats> stats = new LinkedHashMap<>();
        for (String name : listQueues()) {
            WorkQueue<?> queue = queues.get(name);
            if (queue != null) {
                stats.put(name, queue.getStats());
            }
        }
        return stats;
    }

    public boolean isHealthy() {
        if (stopped) {
            return false;
        }
        for (WorkQueue<?> queue : queues.values()) {
            if (!queue.isHealthy()) {
                return false;
            }
        }
        return true;
    }

    @PreDestroy
    public void stop() {
        stop(shutdownGrace);
    }

    /**
     * Stops every queue, sharing one grace period across all of them.
     */
    public synchronized void stop(Duration grace) {
        if (stopped) {
            return;
        }
        stopped = true;
        logger.info("Stopping {} queues (grace period {}s)", queues.size(), grace.toSeconds());
        long deadline = System.currentTimeMillis() + grace.toMillis();
        for (WorkQueue<?> queue : queues.values()) {
            long remaining = Math.max(0L, deadline - System.currentTimeMillis());
            queue.stop(Duration.ofMillis(remaining));
        }
    }
}
