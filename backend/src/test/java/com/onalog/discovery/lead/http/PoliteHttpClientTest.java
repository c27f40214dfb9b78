package com.onalog.discovery.lead.http;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setGlobalConcurrency(2);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        executor = Executors.newFixedThreadPool(2);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>").setHeader("Content-Type", "text/html"));

        HttpFetchResult result = client.get(server.url("/page").toString(), PoliteHttpClient.ACCEPT_HTML);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).contains("ok");
        assertThat(result.isHtml()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void singleAttemptDoesNotRetry() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(200));

        HttpFetchResult result = client.getOnce(server.url("/once").toString(), PoliteHttpClient.ACCEPT_HTML, Duration.ofSeconds(2));

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void rateLimitIsReturnedWithoutRetry() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        HttpFetchResult result = client.get(server.url("/limited").toString(), PoliteHttpClient.ACCEPT_JSON);

        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(result.isRateLimited()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void sendsCustomHeadersAndUserAgent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        client.get(
            server.url("/api").toString(),
            PoliteHttpClient.ACCEPT_JSON,
            Duration.ofSeconds(2),
            Map.of("Ocp-Apim-Subscription-Key", "secret")
        );

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("Ocp-Apim-Subscription-Key")).isEqualTo("secret");
        assertThat(request.getHeader("Accept")).isEqualTo(PoliteHttpClient.ACCEPT_JSON);
        assertThat(request.getHeader("User-Agent")).contains("OnalogLeadBot");
    }

    @Test
    void slowResponseTimesOut() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        HttpFetchResult result = client.get(server.url("/slow").toString(), PoliteHttpClient.ACCEPT_HTML, Duration.ofMillis(300));

        assertThat(result.isTimeout()).isTrue();
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void malformedUrlIsReportedNotThrown() {
        HttpFetchResult result = client.get("http://", PoliteHttpClient.ACCEPT_HTML);

        assertThat(result.errorCode()).isEqualTo(HttpFetchResult.ERROR_INVALID_URL);
    }
}
