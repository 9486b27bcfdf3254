package com.delta.digest.tracker.notify;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.http.PoliteHttpClient;
import com.delta.digest.tracker.model.HttpFetchResult;
import com.delta.digest.tracker.model.ItemGroup;
import com.delta.digest.tracker.model.NotificationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ResendNotificationSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(ResendNotificationSender.class);

    private final TrackerProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DigestRenderer renderer;
    private final Clock clock;

    public ResendNotificationSender(
        TrackerProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        DigestRenderer renderer,
        Clock clock
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.renderer = renderer;
        this.clock = clock;
    }

    @Override
    public NotificationResult send(List<ItemGroup> groups) {
        TrackerProperties.Notification notification = properties.getNotification();
        List<String> recipients = notification.getRecipients();
        if (notification.getApiKey() == null || notification.getApiKey().isBlank() || recipients.isEmpty()) {
            log.info("Notification not configured, skipping send");
            return NotificationResult.failed("Email not configured");
        }
        int total = ItemGroups.totalItems(groups);
        if (total == 0) {
            return NotificationResult.sent();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", notification.getFrom());
        payload.put("to", recipients);
        payload.put("subject", notification.getSubject() + ": " + total + " new posts");
        payload.put("html", renderer.renderDigest(groups, clock.instant()));

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return NotificationResult.failed("Failed to serialize email: " + e.getOriginalMessage());
        }
        HttpFetchResult result = httpClient.postJson(
            trimTrailingSlash(notification.getApiUrl()) + "/emails",
            body,
            "application/json",
            Map.of("Authorization", "Bearer " + notification.getApiKey())
        );
        if (result.isSuccessful()) {
            log.info("Digest with {} posts sent to {} recipients", total, recipients.size());
            return NotificationResult.sent();
        }
        String error = errorMessage(result);
        log.warn("Digest send failed: {}", error);
        return NotificationResult.failed(error);
    }

    private String errorMessage(HttpFetchResult result) {
        if (result.errorCode() == null && result.body() != null && !result.body().isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(result.body());
                String message = node.path("message").asText(null);
                if (message != null && !message.isBlank()) {
                    return message;
                }
            } catch (JsonProcessingException e) {
                log.debug("Unreadable error body from notification API: {}", e.getOriginalMessage());
            }
        }
        return result.describeFailure();
    }

    private static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
