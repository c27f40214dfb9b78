package com.onalog.discovery.lead.http;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Outbound HTTP for provider APIs and business websites. Requests are bounded by a global and a per-host
 * permit count, spaced by a per-host delay, and pushed back when a host answers 403/429.
 */
@Service
public class PoliteHttpClient {
    public static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    public static final String ACCEPT_JSON = "application/json";

    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);

    private final DiscoveryProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        DiscoveryProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, null, Map.of());
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        return get(url, acceptHeader, timeout, Map.of());
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout, Map<String, String> headers) {
        return send(new RequestSpec(url, acceptHeader, timeout, headers), true);
    }

    /**
     * Single attempt without the client's own retry loop, for callers that run their own backoff schedule.
     */
    public HttpFetchResult getOnce(String url, String acceptHeader, Duration timeout) {
        return send(new RequestSpec(url, acceptHeader, timeout, Map.of()), false);
    }

    private HttpFetchResult send(RequestSpec spec, boolean retry) {
        int maxAttempts = retry ? 1 + properties.getRequestMaxRetries() : 1;
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(spec);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(RequestSpec spec) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(spec.url());
        if (uri == null || uri.getHost() == null) {
            return errorResult(spec.url(), startedAt, HttpFetchResult.ERROR_INVALID_URL, "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(properties.getPerHostConcurrency())
            );
            hostLimiter.acquire();
            hostAcquired = true;
            enforcePerHostDelay(host);

            String safeAccept = (spec.accept() == null || spec.accept().isBlank()) ? "*/*" : spec.accept();
            Duration timeout = spec.timeout() == null
                ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
                : spec.timeout();
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8");
            if (spec.headers() != null) {
                spec.headers().forEach(builder::setHeader);
            }
            HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                extendBackoff(host, BACKOFF_DURATION);
            }
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                spec.url(),
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(spec.url(), startedAt, HttpFetchResult.ERROR_TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(spec.url(), startedAt, HttpFetchResult.ERROR_IO, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(spec.url(), startedAt, HttpFetchResult.ERROR_INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(spec.url(), startedAt, HttpFetchResult.ERROR_HTTP, e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return !errorCode.equals(HttpFetchResult.ERROR_INVALID_URL)
                && !errorCode.equals(HttpFetchResult.ERROR_INTERRUPTED)
                && !errorCode.equals(HttpFetchResult.ERROR_TIMEOUT);
        }
        int status = result.statusCode();
        return status == 408 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    static URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record RequestSpec(String url, String accept, Duration timeout, Map<String, String> headers) {
    }
}
