package com.motionindex.shared.exception;

/**
 * Results were requested for a job that has not finished yet.
 */
public class JobNotReadyException extends RuntimeException {

    private final String jobId;
    private final String status;

    public JobNotReadyException(String jobId, String status) {
        super("Job " + jobId + " is not finished yet (status: " + status + ")");
        this.jobId = jobId;
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public String getStatus() {
        return status;
    }
}
