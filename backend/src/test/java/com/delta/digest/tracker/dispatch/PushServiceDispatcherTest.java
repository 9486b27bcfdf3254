package com.delta.digest.tracker.dispatch;

import com.delta.digest.config.TrackerConfig;
import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.http.PoliteHttpClient;
import com.delta.digest.tracker.model.FetchBatchRequest;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PushServiceDispatcherTest {
    private MockWebServer server;
    private ExecutorService executor;
    private TrackerProperties properties;
    private PushServiceDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new TrackerProperties();
        properties.setRequestRetryBaseDelayMs(1);
        properties.getDispatch().setMode("push");
        properties.getDispatch().setApiUrl(server.url("/").toString());
        properties.getDispatch().setBaseUrl("https://tracker.example.com");
        properties.getDispatch().setToken("qstash-token");
        dispatcher = new PushServiceDispatcher(
            properties,
            new PoliteHttpClient(properties, executor),
            new TrackerConfig().objectMapper()
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void publishesToDestinationAndReturnsMessageId() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"messageId\":\"msg_123\"}"));

        String messageId = dispatcher.publish("/api/job/fetch", new FetchBatchRequest("job-1", 2), 3, Duration.ZERO);

        assertThat(messageId).isEqualTo("msg_123");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v2/publish/https://tracker.example.com/api/job/fetch");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer qstash-token");
        assertThat(request.getHeader("Upstash-Retries")).isEqualTo("3");
        assertThat(request.getHeader("Upstash-Delay")).isNull();
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"jobId\":\"job-1\",\"batchIndex\":2}");
    }

    @Test
    void sendsDelayHeaderInSeconds() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"messageId\":\"msg_9\"}"));

        dispatcher.publish("/api/job/discover", new FetchBatchRequest("job-1", 1), 0, Duration.ofSeconds(30));

        assertThat(server.takeRequest().getHeader("Upstash-Delay")).isEqualTo("30s");
    }

    @Test
    void errorResponseBecomesDispatchException() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid token\"}"));

        assertThatThrownBy(() -> dispatcher.publish("/api/job/fetch", new FetchBatchRequest("job-1", 0), 3, Duration.ZERO))
            .isInstanceOf(DispatchException.class)
            .hasMessageContaining("HTTP 401");
    }

    @Test
    void failedPublishIsNotRepeated() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"messageId\":\"msg_2\"}"));

        assertThatThrownBy(() -> dispatcher.publish("/api/job/fetch", new FetchBatchRequest("job-1", 0), 3, Duration.ZERO))
            .isInstanceOf(DispatchException.class)
            .hasMessageContaining("HTTP 503");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void responseWithoutMessageIdIsRejected() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        assertThatThrownBy(() -> dispatcher.publish("/api/job/fetch", new FetchBatchRequest("job-1", 0), 3, Duration.ZERO))
            .isInstanceOf(DispatchException.class)
            .hasMessageContaining("messageId");
    }

    @Test
    void missingTokenFailsWithoutCallingOut() {
        properties.getDispatch().setToken(" ");

        assertThatThrownBy(() -> dispatcher.publish("/api/job/fetch", new FetchBatchRequest("job-1", 0), 3, Duration.ZERO))
            .isInstanceOf(DispatchException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
