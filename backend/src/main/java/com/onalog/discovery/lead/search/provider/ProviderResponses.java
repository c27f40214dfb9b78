package com.onalog.discovery.lead.search.provider;

import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.model.ProviderFailure;
import com.onalog.discovery.lead.model.ProviderResult;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

final class ProviderResponses {
    private ProviderResponses() {
    }

    static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    static ProviderResult failureOf(String provider, HttpFetchResult fetch) {
        if (fetch.isTimeout()) {
            return ProviderResult.failure(provider, ProviderFailure.TIMEOUT, fetch.describeFailure());
        }
        if (fetch.statusCode() == 429) {
            return ProviderResult.failure(provider, ProviderFailure.RATE_LIMITED, fetch.describeFailure());
        }
        if (fetch.statusCode() == 401 || fetch.statusCode() == 403) {
            return ProviderResult.failure(provider, ProviderFailure.AUTH_MISSING, fetch.describeFailure());
        }
        return ProviderResult.failure(provider, ProviderFailure.ERROR, fetch.describeFailure());
    }

    static String withScheme(String website) {
        if (website == null || website.isBlank()) {
            return null;
        }
        String trimmed = website.trim();
        return trimmed.regionMatches(true, 0, "http", 0, 4) ? trimmed : "https://" + trimmed;
    }
}
