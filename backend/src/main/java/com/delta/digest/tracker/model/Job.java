package com.delta.digest.tracker.model;

import java.time.Instant;

public record Job(
    int schemaVersion,
    String id,
    JobStatus status,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt,
    String error,
    int discoveryTargetsTotal,
    int discoveryTargetsComplete,
    int fetchTargetsTotal,
    int fetchTargetsComplete,
    int totalNewItems,
    boolean notificationSent,
    String notificationError
) {
    public static final int SCHEMA_VERSION = 1;

    public static Job started(String id, Instant now, int discoveryTargets) {
        return new Job(
            SCHEMA_VERSION,
            id,
            JobStatus.DISCOVERING,
            now,
            now,
            null,
            null,
            discoveryTargets,
            0,
            0,
            0,
            0,
            false,
            null
        );
    }

    public Job withStatus(JobStatus newStatus) {
        return new Job(schemaVersion, id, newStatus, startedAt, updatedAt, completedAt, error,
            discoveryTargetsTotal, discoveryTargetsComplete, fetchTargetsTotal, fetchTargetsComplete,
            totalNewItems, notificationSent, notificationError);
    }

    public Job withUpdatedAt(Instant instant) {
        return new Job(schemaVersion, id, status, startedAt, instant, completedAt, error,
            discoveryTargetsTotal, discoveryTargetsComplete, fetchTargetsTotal, fetchTargetsComplete,
            totalNewItems, notificationSent, notificationError);
    }

    public Job withCompletedAt(Instant instant) {
        return new Job(schemaVersion, id, status, startedAt, updatedAt, instant, error,
            discoveryTargetsTotal, discoveryTargetsComplete, fetchTargetsTotal, fetchTargetsComplete,
            totalNewItems, notificationSent, notificationError);
    }

    public Job withError(String message) {
        return new Job(schemaVersion, id, status, startedAt, updatedAt, completedAt, message,
            discoveryTargetsTotal, discoveryTargetsComplete, fetchTargetsTotal, fetchTargetsComplete,
            totalNewItems, notificationSent, notificationError);
    }

    public Job withDiscoveryProgress(int completedDelta, int fetchTargetsDelta, int newItemsDelta) {
        return new Job(schemaVersion, id, status, startedAt, updatedAt, completedAt, error,
            discoveryTargetsTotal,
            discoveryTargetsComplete + Math.max(0, completedDelta),
            fetchTargetsTotal + Math.max(0, fetchTargetsDelta),
            fetchTargetsComplete,
            totalNewItems + Math.max(0, newItemsDelta),
            notificationSent,
            notificationError);
    }

    public Job withFetchProgress(int completedDelta) {
        return new Job(schemaVersion, id, status, startedAt, updatedAt, completedAt, error,
            discoveryTargetsTotal, discoveryTargetsComplete, fetchTargetsTotal,
            fetchTargetsComplete + Math.max(0, completedDelta),
            totalNewItems, notificationSent, notificationError);
    }

    public Job withNotification(boolean sent, String failure) {
        return new Job(schemaVersion, id, status, startedAt, updatedAt, completedAt, error,
            discoveryTargetsTotal, discoveryTargetsComplete, fetchTargetsTotal, fetchTargetsComplete,
            totalNewItems, sent, failure);
    }
}
