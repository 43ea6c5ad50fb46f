package com.motionindex.shared.model;

/**
 * Progress counters of a batch job.
 * <p>
 * Counters only move through the record methods, so
 * {@code processed == success + error + skipped} holds after every update.
 */
public class JobProgress {

    private final int total;
    private int processed;
    private int success;
    private int error;
    private int skipped;
    private int indexed;
    private int indexError;
    private double percent;

    public JobProgress(int total) {
        this.total = total;
    }

    public void recordSuccess() {
        success++;
        advance();
    }

    public void recordError() {
        error++;
        advance();
    }

    public void recordSkipped() {
        skipped++;
        advance();
    }

    public void recordIndexed() {
        indexed++;
    }

    public void recordIndexError() {
        indexError++;
    }

    private void advance() {
        processed++;
        if (total <= 0) {
            percent = 0.0;
            return;
        }
        percent = Math.max(0.0, Math.min(100.0, processed * 100.0 / total));
    }

    public JobProgress copy() {
        JobProgress copy = new JobProgress(total);
        copy.processed = processed;
        copy.success = success;
        copy.error = error;
        copy.skipped = skipped;
        copy.indexed = indexed;
        copy.indexError = indexError;
        copy.percent = percent;
        return copy;
    }

    public int getTotal() {
        return total;
    }

    public int getProcessed() {
        return processed;
    }

    public int getSuccess() {
        return success;
    }

    public int getError() {
        return error;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getIndexed() {
        return indexed;
    }

    public int getIndexError() {
        return indexError;
    }

    public double getPercent() {
        return percent;
    }
}
