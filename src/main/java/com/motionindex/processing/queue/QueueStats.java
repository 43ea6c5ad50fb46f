package com.motionindex.processing.queue;

/**
 * Point-in-time counters for one queue.
 */
public class QueueStats {

    private final String name;
    private final String itemType;
    private final int depth;
    private final int capacity;
    private final int workers;
    private final int inFlight;
    private final long enqueued;
    private final long processed;
    private final long failed;
    private final long retried;
    private final long rejected;
    private final boolean running;

    public QueueStats(String name, String itemType, int depth, int capacity, int workers, int inFlight,
                      long enqueued, long processed, long failed, long retried, long rejected, boolean running) {
        this.name = name;
        this.itemType = itemType;
        this.depth = depth;
        this.capacity = capacity;
        this.workers = workers;
        this.inFlight = inFlight;
        this.enqueued = enqueued;
        this.processed = processed;
        this.failed = failed;
        this.retried = retried;
        this.rejected = rejected;
        this.running = running;
    }

    public String getName() {
        return name;
    }

    public String getItemType() {
        return itemType;
    }

    public int getDepth() {
        return depth;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getWorkers() {
        return workers;
    }

    public int getInFlight() {
        return inFlight;
    }

    public long getEnqueued() {
        return enqueued;
    }

    public long getProcessed() {
        return processed;
    }

    public long getFailed() {
        return failed;
    }

    public long getRetried() {
        return retried;
    }

    public long getRejected() {
        return rejected;
    }

    public boolean isRunning() {
        return running;
    }
}
