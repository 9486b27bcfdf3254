package com.delta.digest.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class TrackerPropertiesTest {

    @Test
    void batchSizesAndDelaysAreClamped() {
        TrackerProperties properties = new TrackerProperties();
        properties.getJob().setDiscoveryBatchSize(0);
        properties.getJob().setFetchBatchSize(-3);
        properties.getJob().setRequestDelayMs(-1);
        properties.getJob().setTimeoutMinutes(0);
        properties.getDispatch().setRetries(-2);

        assertThat(properties.getJob().getDiscoveryBatchSize()).isEqualTo(1);
        assertThat(properties.getJob().getFetchBatchSize()).isEqualTo(1);
        assertThat(properties.getJob().getRequestDelayMs()).isZero();
        assertThat(properties.getJob().getTimeoutMinutes()).isEqualTo(1);
        assertThat(properties.getDispatch().getRetries()).isZero();
    }

    @Test
    void urlsLoseTrailingSlashes() {
        TrackerProperties properties = new TrackerProperties();
        properties.getDispatch().setBaseUrl(" https://tracker.example.com// ");
        properties.getDispatch().setApiUrl(null);

        assertThat(properties.getDispatch().getBaseUrl()).isEqualTo("https://tracker.example.com");
        assertThat(properties.getDispatch().getApiUrl()).isEmpty();
    }

    @Test
    void recipientsAcceptCommaSeparatedValues() {
        TrackerProperties properties = new TrackerProperties();
        properties.getNotification().setRecipients(Arrays.asList("a@example.com, b@example.com", null, " ", "c@example.com"));

        assertThat(properties.getNotification().getRecipients())
            .containsExactly("a@example.com", "b@example.com", "c@example.com");
    }

    @Test
    void blankUserAgentAndZoneFallBackToDefaults() {
        TrackerProperties properties = new TrackerProperties();
        properties.setUserAgent("  ");
        properties.getJob().setZone(" ");

        assertThat(properties.getUserAgent()).startsWith("Mozilla/5.0");
        assertThat(properties.getJob().getZone()).isEqualTo("UTC");
    }
}
