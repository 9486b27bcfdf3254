package com.delta.digest.tracker.dispatch;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.http.PoliteHttpClient;
import com.delta.digest.tracker.model.HttpFetchResult;
import com.delta.digest.tracker.security.RequestVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

@Service
@ConditionalOnProperty(prefix = "tracker.dispatch", name = "mode", havingValue = "loopback", matchIfMissing = true)
public class LoopbackDispatcher implements ContinuationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(LoopbackDispatcher.class);

    private final TrackerProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService dispatchExecutor;

    public LoopbackDispatcher(
        TrackerProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.dispatchExecutor = dispatchExecutor;
        TrackerProperties.Security security = properties.getSecurity();
        String secret = security.getTriggerSecret();
        if (!security.isLocalBypassEnabled() && (secret == null || secret.isBlank())) {
            log.warn("Loopback dispatch has neither a trigger secret nor the local bypass; continuations will be rejected");
        }
    }

    @Override
    public String publish(String endpointPath, Object payload, int retries, Duration delay) {
        String url = properties.getDispatch().getBaseUrl() + endpointPath;
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to serialize continuation payload", e);
        }
        String messageId = "local-" + UUID.randomUUID();
        dispatchExecutor.execute(() -> deliver(messageId, url, body, retries, delay));
        log.info("Queued local continuation {} to {}", messageId, url);
        return messageId;
    }

    private void deliver(String messageId, String url, String body, int retries, Duration delay) {
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Local continuation {} interrupted before delivery", messageId);
                return;
            }
        }
        int attempts = Math.max(1, retries + 1);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            HttpFetchResult result = httpClient.postJson(url, body, "application/json", deliveryHeaders());
            if (result.isSuccessful()) {
                log.info("Local continuation {} delivered to {}", messageId, url);
                return;
            }
            if ("timeout".equals(result.errorCode())) {
                // the phase is still running on the other end; a resend would start a second batch
                log.info("Local continuation {} sent to {}, response not awaited", messageId, url);
                return;
            }
            log.warn("Local continuation {} to {} failed on attempt {}/{}: {}",
                messageId, url, attempt, attempts, result.describeFailure());
            if (!isRedeliverable(result)) {
                return;
            }
        }
    }

    private Map<String, String> deliveryHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RequestVerifier.LOCAL_DEV_HEADER, "true");
        String secret = properties.getSecurity().getTriggerSecret();
        if (secret != null && !secret.isBlank()) {
            headers.put("Authorization", "Bearer " + secret);
        }
        return headers;
    }

    // only failures where the endpoint never started work
    private static boolean isRedeliverable(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return "connect_error".equals(result.errorCode());
        }
        return result.statusCode() >= 500;
    }
}
