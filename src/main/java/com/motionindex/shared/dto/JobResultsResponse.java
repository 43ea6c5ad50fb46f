package com.motionindex.shared.dto;

import com.motionindex.shared.model.BatchJob;
import com.motionindex.shared.model.DocumentResult;
import com.motionindex.shared.model.JobProgress;
import com.motionindex.shared.model.JobStatus;

import java.time.Instant;
import java.util.List;

/**
 * DTO for the results of a finished batch job.
 */
public class JobResultsResponse {

    private final String jobId;
    private final JobStatus status;
    private final int totalDocuments;
    private final int successCount;
    private final int errorCount;
    private final int skippedCount;
    private final int indexedCount;
    private final int indexErrorCount;
    private final List<DocumentResult> results;
    private final String error;
    private final Instant completedAt;

    private JobResultsResponse(BatchJob job) {
        JobProgress progress = job.getProgress();
        this.jobId = job.getId();
        this.status = job.getStatus();
        this.totalDocuments = progress.getTotal();
        this.successCount = progress.getSuccess();
        this.errorCount = progress.getError();
        this.skippedCount = progress.getSkipped();
        this.indexedCount = progress.getIndexed();
        this.indexErrorCount = progress.getIndexError();
        this.results = job.getResults();
        this.error = job.getError();
        this.completedAt = job.getCompletedAt();
    }

    public static JobResultsResponse from(BatchJob job) {
        return new JobResultsResponse(job);
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getTotalDocuments() {
        return totalDocuments;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public int getIndexedCount() {
        return indexedCount;
    }

    public int getIndexErrorCount() {
        return indexErrorCount;
    }

    public List<DocumentResult> getResults() {
        return results;
    }

    public String getError() {
        return error;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
