package com.delta.digest.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseResult(
    boolean success,
    boolean stale,
    String message,
    String jobId,
    Integer batchIndex,
    Integer processed,
    Integer newItems,
    Integer queuedForFetch,
    Integer fetched,
    Integer skipped,
    Boolean notificationSent,
    String notificationError
) {
    public static PhaseResult stale(String jobId, Integer batchIndex, JobStatus actual) {
        return new PhaseResult(true, true, "Stale callback ignored, job is " + actual.wireName(),
            jobId, batchIndex, null, null, null, null, null, null, null);
    }

    public static PhaseResult queueEmpty(String jobId, Integer batchIndex) {
        return new PhaseResult(true, false, "Queue empty", jobId, batchIndex,
            0, null, null, null, null, null, null);
    }

    public static PhaseResult discovered(String jobId, int batchIndex, int processed, int newItems, int queuedForFetch) {
        return new PhaseResult(true, false, "Discovery batch processed", jobId, batchIndex,
            processed, newItems, queuedForFetch, null, null, null, null);
    }

    public static PhaseResult fetched(String jobId, int batchIndex, int processed, int fetched, int skipped) {
        return new PhaseResult(true, false, "Fetch batch processed", jobId, batchIndex,
            processed, null, null, fetched, skipped, null, null);
    }

    public static PhaseResult finalized(String jobId, int totalItems, boolean notificationSent, String notificationError) {
        String message = totalItems == 0 ? "No new items to send" : "Job finalized";
        return new PhaseResult(true, false, message, jobId, null,
            totalItems, null, null, null, null, notificationSent, notificationError);
    }

    public static PhaseResult failed(String jobId, Integer batchIndex, String error) {
        return new PhaseResult(false, false, error, jobId, batchIndex,
            null, null, null, null, null, null, null);
    }
}
