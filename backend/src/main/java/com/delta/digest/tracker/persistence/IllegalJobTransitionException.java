package com.delta.digest.tracker.persistence;

import com.delta.digest.tracker.model.JobStatus;

public class IllegalJobTransitionException extends RuntimeException {
    public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from.wireName() + " -> " + to.wireName());
    }
}
