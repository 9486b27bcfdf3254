package com.delta.digest.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResult(
    boolean success,
    boolean started,
    String message,
    String jobId,
    JobStatus status,
    Integer discoveryTargets,
    String reapedJobId,
    String messageId
) {
    public static TriggerResult alreadyRunning(Job active) {
        return new TriggerResult(true, false, "Job already in progress", active.id(), active.status(),
            null, null, null);
    }

    public static TriggerResult started(Job job, String reapedJobId, String messageId) {
        return new TriggerResult(true, true, "Job started", job.id(), job.status(),
            job.discoveryTargetsTotal(), reapedJobId, messageId);
    }
}
