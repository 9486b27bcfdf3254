package com.delta.digest.tracker.persistence;

public final class StoreKeys {
    public static final String ACTIVE_JOB = "current_job";
    public static final String LAST_JOB = "last_job";
    public static final String SEEN_ITEMS = "seen_items";
    public static final String LAST_RUN = "last_run";
    public static final String JOB_KEY_PATTERN = "job:*";

    private StoreKeys() {
    }

    public static String job(String jobId) {
        return "job:" + jobId;
    }

    public static String items(String jobId) {
        return "job:" + jobId + ":items";
    }

    public static String discoveryQueue(String jobId) {
        return "job:" + jobId + ":discovery_queue";
    }

    public static String fetchQueue(String jobId) {
        return "job:" + jobId + ":fetch_queue";
    }
}
