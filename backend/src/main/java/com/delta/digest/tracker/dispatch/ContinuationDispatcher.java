package com.delta.digest.tracker.dispatch;

import java.time.Duration;

public interface ContinuationDispatcher {
    String publish(String endpointPath, Object payload, int retries, Duration delay);
}
