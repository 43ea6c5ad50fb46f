package com.motionindex.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One asynchronous batch classification run.
 * <p>
 * The live instance belongs to the batch engine and is only mutated under its job
 * table lock. Everything handed to callers is a {@link #snapshot()}.
 */
public class BatchJob {

    private final String id;
    private final String type;
    private JobStatus status;
    private final JobProgress progress;
    private final List<DocumentResult> results;
    private String error;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private final Map<String, Object> options;
    private boolean finished;

    public BatchJob(String id, String type, int totalDocuments, Map<String, Object> options) {
        this.id = id;
        this.type = type;
        this.status = JobStatus.QUEUED;
        this.progress = new JobProgress(totalDocuments);
        this.results = new ArrayList<>(totalDocuments);
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        this.options = options != null ? new HashMap<>(options) : new HashMap<>();
    }

    private BatchJob(BatchJob source) {
        this.id = source.id;
        this.type = source.type;
        this.status = source.status;
        this.progress = source.progress.copy();
        this.results = new ArrayList<>(source.results.size());
        for (DocumentResult result : source.results) {
            this.results.add(result.copy());
        }
        this.error = source.error;
        this.createdAt = source.createdAt;
        this.updatedAt = source.updatedAt;
        this.completedAt = source.completedAt;
        this.options = new HashMap<>(source.options);
        this.finished = source.finished;
    }

    /**
     * Deep copy that shares no mutable state with this job.
     */
    public BatchJob snapshot() {
        return new BatchJob(this);
    }

    /**
     * Reads a boolean flag from the options map. Accepts booleans and "true"/"false" strings.
     */
    public boolean isOptionEnabled(String key) {
        Object value = options.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public void addResult(DocumentResult result) {
        results.add(result);
        switch (result.getStatus()) {
            case SUCCESS:
                progress.recordSuccess();
                break;
            case ERROR:
                progress.recordError();
                break;
            default:
                progress.recordSkipped();
                break;
        }
        touch();
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
        touch();
    }

    public JobProgress getProgress() {
        return progress;
    }

    public List<DocumentResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Live result at the given position, for index reconciliation.
     */
    @JsonIgnore
    public DocumentResult getResultAt(int position) {
        return results.get(position);
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Map<String, Object> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    /**
     * True once the background task has handed back the job, including the bulk index step.
     */
    @JsonIgnore
    public boolean isFinished() {
        return finished;
    }

    public void setFinished(boolean finished) {
        this.finished = finished;
    }
}
