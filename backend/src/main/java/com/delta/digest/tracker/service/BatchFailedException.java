package com.delta.digest.tracker.service;

public class BatchFailedException extends RuntimeException {
    private final String jobId;
    private final Integer batchIndex;

    public BatchFailedException(String jobId, Integer batchIndex, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.batchIndex = batchIndex;
    }

    public String getJobId() {
        return jobId;
    }

    public Integer getBatchIndex() {
        return batchIndex;
    }
}
