package com.delta.digest.tracker.model;

public record NotificationResult(boolean success, String error) {
    public static NotificationResult sent() {
        return new NotificationResult(true, null);
    }

    public static NotificationResult failed(String error) {
        return new NotificationResult(false, error);
    }
}
