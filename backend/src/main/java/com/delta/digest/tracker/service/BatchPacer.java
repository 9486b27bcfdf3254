package com.delta.digest.tracker.service;

import com.delta.digest.config.TrackerProperties;
import org.springframework.stereotype.Component;

@Component
public class BatchPacer {
    private final TrackerProperties properties;

    public BatchPacer(TrackerProperties properties) {
        this.properties = properties;
    }

    public void beforeCall(int indexInBatch) {
        long delayMs = properties.getJob().getRequestDelayMs();
        if (indexInBatch <= 0 || delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing requests", e);
        }
    }
}
