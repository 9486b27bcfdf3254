package com.delta.digest.tracker.dispatch;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.model.DiscoverBatchRequest;
import com.delta.digest.tracker.model.FetchBatchRequest;
import com.delta.digest.tracker.model.FinalizeRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class ContinuationPublisher {
    public static final String DISCOVER_PATH = "/api/job/discover";
    public static final String FETCH_PATH = "/api/job/fetch";
    public static final String FINALIZE_PATH = "/api/job/finalize";

    private final ContinuationDispatcher dispatcher;
    private final TrackerProperties properties;

    public ContinuationPublisher(ContinuationDispatcher dispatcher, TrackerProperties properties) {
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    public String discover(String jobId, int batchIndex) {
        return publish(DISCOVER_PATH, new DiscoverBatchRequest(jobId, batchIndex));
    }

    public String fetch(String jobId, int batchIndex) {
        return publish(FETCH_PATH, new FetchBatchRequest(jobId, batchIndex));
    }

    public String finalizeJob(String jobId) {
        return publish(FINALIZE_PATH, new FinalizeRequest(jobId));
    }

    private String publish(String path, Object payload) {
        return dispatcher.publish(path, payload, properties.getDispatch().getRetries(), Duration.ZERO);
    }
}
