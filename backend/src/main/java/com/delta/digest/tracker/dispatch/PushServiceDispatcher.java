package com.delta.digest.tracker.dispatch;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.http.PoliteHttpClient;
import com.delta.digest.tracker.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@ConditionalOnProperty(prefix = "tracker.dispatch", name = "mode", havingValue = "push")
public class PushServiceDispatcher implements ContinuationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(PushServiceDispatcher.class);

    private final TrackerProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PushServiceDispatcher(TrackerProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String publish(String endpointPath, Object payload, int retries, Duration delay) {
        TrackerProperties.Dispatch dispatch = properties.getDispatch();
        if (dispatch.getToken() == null || dispatch.getToken().isBlank()) {
            throw new DispatchException("tracker.dispatch.token is not configured");
        }
        String destination = dispatch.getBaseUrl() + endpointPath;
        String body = toJson(payload);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + dispatch.getToken());
        headers.put("Upstash-Retries", String.valueOf(Math.max(0, retries)));
        if (delay != null && delay.getSeconds() > 0) {
            headers.put("Upstash-Delay", delay.getSeconds() + "s");
        }

        log.info("Publishing continuation to {}", destination);
        HttpFetchResult result = httpClient.postJson(
            dispatch.getApiUrl() + "/v2/publish/" + destination,
            body,
            "application/json",
            headers
        );
        if (!result.isSuccessful()) {
            throw new DispatchException("Failed to publish to " + endpointPath + ": " + result.describeFailure());
        }
        String messageId = readMessageId(result.body());
        log.info("Continuation {} published to {}", messageId, endpointPath);
        return messageId;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to serialize continuation payload", e);
        }
    }

    private String readMessageId(String body) {
        if (body == null || body.isBlank()) {
            throw new DispatchException("Push service returned an empty response");
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            String messageId = node.path("messageId").asText(null);
            if (messageId == null || messageId.isBlank()) {
                throw new DispatchException("Push service response had no messageId");
            }
            return messageId;
        } catch (JsonProcessingException e) {
            throw new DispatchException("Push service returned malformed JSON", e);
        }
    }
}
