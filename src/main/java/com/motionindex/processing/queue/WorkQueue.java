package com.motionindex.processing.queue;

import com.motionindex.observability.DatadogMetricsServiceInterface;
import com.motionindex.util.Deadlines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A named, bounded work queue drained by a fixed pool of workers.
 * <p>
 * {@link #enqueue} never blocks: a full queue rejects with {@link QueueFullException}.
 * Each worker takes one item at a time and runs the bound {@link QueueProcessor} under
 * the per-item timeout. A failed attempt is retried after a fixed delay until the item's
 * retry budget is spent, then the item is counted as permanently failed.
 */
public class WorkQueue<T> {

    private static final Logger logger = LoggerFactory.getLogger(WorkQueue.class);
    private static final long POLL_INTERVAL_MS = 200;

    private final QueueSettings settings;
    private final Class<T> payloadType;
    private final QueueProcessor<T> processor;
    private final DatadogMetricsServiceInterface metricsService;
    private final BlockingQueue<QueueItem<T>> items;
    private final ExecutorService workerPool;
    private final ExecutorService taskPool;
    private final AsyncTaskExecutor taskExecutor;

    private volatile boolean accepting;
    private volatile boolean running;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public WorkQueue(QueueSettings settings, Class<T> payloadType, QueueProcessor<T> processor,
                     DatadogMetricsServiceInterface metricsService) {
        this.settings = settings;
        this.payloadType = payloadType;
        this.processor = processor;
        this.metricsService = metricsService;
        this.items = new LinkedBlockingQueue<>(settings.getMaxSize());
        this.workerPool = Executors.newFixedThreadPool(settings.getWorkerCount(),
                new CustomizableThreadFactory("queue-" + settings.getName() + "-worker-"));
        // Attempts get an idle or fresh thread, never a queue slot: a timed-out attempt that
        // ignores interruption keeps its thread without holding up the next item.
        this.taskPool = Executors.newCachedThreadPool(
                new CustomizableThreadFactory("queue-" + settings.getName() + "-task-"));
        this.taskExecutor = new TaskExecutorAdapter(taskPool);
    }

    /**
     * Starts the workers. Called once by {@link QueueManager} when the queue is registered.
     */
    synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        accepting = true;
        for (int i = 0; i < settings.getWorkerCount(); i++) {
            workerPool.execute(this::workerLoop);
        }
        logger.info("Queue started: {}", settings);
    }

    public QueueItem<T> enqueue(T payload) {
        return enqueue(new QueueItem<>(settings.getItemType(), payload));
    }

    /**
     * Adds an item without blocking.
     *
     * @throws QueueFullException    if the queue is at capacity
     * @throws IllegalStateException if the queue has been stopped
     */
    public QueueItem<T> enqueue(QueueItem<T> item) {
        if (!accepting) {
            throw new IllegalStateException("queue " + settings.getName() + " is not accepting items");
        }
        if (item.getMaxRetries() < 0) {
            item.setMaxRetries(settings.getRetryAttempts());
        }
        if (!items.offer(item)) {
            rejected.incrementAndGet();
            metricsService.recordQueueRejection(settings.getName());
            throw new QueueFullException(settings.getName(), settings.getMaxSize());
        }
        enqueued.incrementAndGet();
        logger.debug("Enqueued item {} on {} (depth {})", item.getId(), settings.getName(), items.size());
        return item;
    }

    private void workerLoop() {
        while (running) {
            QueueItem<T> item;
            try {
                item = items.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (item == null) {
                continue;
            }
            inFlight.incrementAndGet();
            try {
                handle(item);
            } finally {
                inFlight.decrementAndGet();
            }
        }
        logger.debug("Worker on queue {} exiting", settings.getName());
    }

    private void handle(QueueItem<T> item) {
        while (true) {
            try {
                runWithTimeout(item);
                item.markProcessed();
                processed.incrementAndGet();
                return;
            } catch (Exception e) {
                if (!running || item.getRetryCount() >= item.getMaxRetries()) {
                    failed.incrementAndGet();
                    metricsService.recordQueueItemFailure(settings.getName());
                    logger.error("Item {} on queue {} failed permanently after {} retries: {}",
                            item.getId(), settings.getName(), item.getRetryCount(), e.getMessage());
                    return;
                }
                item.incrementRetryCount();
                retried.incrementAndGet();
                logger.warn("Item {} on queue {} failed ({}), retry {}/{} in {}ms", item.getId(),
                        settings.getName(), e.getMessage(), item.getRetryCount(), item.getMaxRetries(),
                        settings.getRetryDelay().toMillis());
                if (!pause(settings.getRetryDelay())) {
                    failed.incrementAndGet();
                    metricsService.recordQueueItemFailure(settings.getName());
                    return;
                }
            }
        }
    }

    private void runWithTimeout(QueueItem<T> item) throws Exception {
        try {
            Deadlines.await(taskExecutor, settings.getProcessTimeout(), () -> {
                processor.process(item);
                return null;
            });
        } catch (TimeoutException e) {
            throw new TimeoutException("processing exceeded " + settings.getProcessTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            throw Deadlines.unwrap(e);
        }
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops accepting items, lets workers finish the item they hold within the grace
     * period, then interrupts whatever is left. Items still waiting are abandoned.
     *
     * @return true if all workers finished within the grace period
     */
    synchronized boolean stop(Duration grace) {
        accepting = false;
        running = false;
        workerPool.shutdown();
        boolean clean;
        try {
            clean = workerPool.awaitTermination(Math.max(0L, grace.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clean = false;
        }
        if (!clean) {
            logger.warn("Queue {} did not drain within {}ms, interrupting workers", settings.getName(), grace.toMillis());
            workerPool.shutdownNow();
        }
        taskPool.shutdownNow();

        int abandoned = items.size();
        items.clear();
        if (abandoned > 0) {
            logger.warn("Queue {} stopped with {} unprocessed items", settings.getName(), abandoned);
        }
        logger.info("Queue stopped: {} (processed={}, failed={})", settings.getName(), processed.get(), failed.get());
        return clean;
    }

    public String getName() {
        return settings.getName();
    }

    public QueueSettings getSettings() {
        return settings;
    }

    Class<T> getPayloadType() {
        return payloadType;
    }

    public int size() {
        return items.size();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isHealthy() {
        return running && !workerPool.isShutdown();
    }

    public QueueStats getStats() {
        return new QueueStats(settings.getName(), settings.getItemType(), items.size(), settings.getMaxSize(),
                settings.getWorkerCount(), inFlight.get(), enqueued.get(), processed.get(), failed.get(),
                retried.get(), rejected.get(), running);
    }
}
