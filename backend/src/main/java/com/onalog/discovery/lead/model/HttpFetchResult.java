package com.onalog.discovery.lead.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_IO = "io_error";
    public static final String ERROR_INTERRUPTED = "interrupted";
    public static final String ERROR_INVALID_URL = "invalid_url";
    public static final String ERROR_HTTP = "http_error";

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTimeout() {
        return ERROR_TIMEOUT.equals(errorCode);
    }

    /**
     * DuckDuckGo answers throttled clients with a 202 and an empty result page.
     */
    public boolean isRateLimited() {
        return statusCode == 429 || statusCode == 403 || statusCode == 202;
    }

    public boolean isHtml() {
        return contentType == null || contentType.toLowerCase().contains("html");
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        return "http_" + statusCode;
    }
}
