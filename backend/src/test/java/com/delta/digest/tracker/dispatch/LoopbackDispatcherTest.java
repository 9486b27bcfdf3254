package com.delta.digest.tracker.dispatch;

import com.delta.digest.config.TrackerConfig;
import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.http.PoliteHttpClient;
import com.delta.digest.tracker.model.DiscoverBatchRequest;
import com.delta.digest.tracker.model.FinalizeRequest;
import com.delta.digest.tracker.security.RequestOrigin;
import com.delta.digest.tracker.security.RequestVerifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LoopbackDispatcherTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService dispatchExecutor;
    private TrackerProperties properties;
    private LoopbackDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(1);
        dispatchExecutor = Executors.newSingleThreadExecutor();
        properties = new TrackerProperties();
        properties.getSecurity().setTriggerSecret("cron-secret");
        String base = server.url("/").toString();
        properties.getDispatch().setBaseUrl(base);
        dispatcher = new LoopbackDispatcher(
            properties,
            new PoliteHttpClient(properties, httpExecutor),
            new TrackerConfig().objectMapper(),
            dispatchExecutor
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        dispatchExecutor.shutdownNow();
    }

    @Test
    void deliversToOwnEndpointWithLocalDevHeader() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"success\":true}"));
        properties.getSecurity().setTriggerSecret(null);

        String messageId = dispatcher.publish("/api/job/finalize", new FinalizeRequest("job-1"), 3, Duration.ZERO);

        assertThat(messageId).startsWith("local-");
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/api/job/finalize");
        assertThat(request.getHeader("X-Local-Dev")).isEqualTo("true");
        assertThat(request.getHeader("Authorization")).isNull();
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"jobId\":\"job-1\"}");
    }

    @Test
    void retriesServerErrorsUpToRetryCount() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(200));

        dispatcher.publish("/api/job/finalize", new FinalizeRequest("job-1"), 2, Duration.ZERO);

        for (int i = 0; i < 3; i++) {
            assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        }
        dispatchExecutor.shutdown();
        assertThat(dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void stopsOnClientError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setResponseCode(200));

        dispatcher.publish("/api/job/finalize", new FinalizeRequest("job-1"), 3, Duration.ZERO);

        dispatchExecutor.shutdown();
        assertThat(dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void deliveryWithDefaultSecurityPassesVerificationThroughTriggerSecret() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"success\":true}"));
        assertThat(properties.getSecurity().isLocalBypassEnabled()).isFalse();

        dispatcher.publish("/api/job/discover", new DiscoverBatchRequest("job-1", 0), 3, Duration.ZERO);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer cron-secret");
        RequestVerifier verifier = new RequestVerifier(properties, Clock.systemUTC());
        RequestOrigin origin = verifier.verify(
            request.getHeader("Authorization"),
            request.getHeader("X-Local-Dev"),
            request.getHeader("Upstash-Signature"),
            request.getBody().readUtf8(),
            "/api/job/discover"
        );
        assertThat(origin).isEqualTo(RequestOrigin.TRIGGER_SECRET);
    }

    @Test
    void timedOutDeliveryIsNotResent() throws Exception {
        properties.setRequestTimeoutSeconds(1);
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(200).setHeadersDelay(2, TimeUnit.SECONDS));
        }

        dispatcher.publish("/api/job/discover", new DiscoverBatchRequest("job-1", 0), 3, Duration.ZERO);

        dispatchExecutor.shutdown();
        assertThat(dispatchExecutor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }
}
