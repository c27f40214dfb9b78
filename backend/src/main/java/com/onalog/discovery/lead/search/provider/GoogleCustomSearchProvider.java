package com.onalog.discovery.lead.search.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.classify.DirectorySites;
import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.ProviderFailure;
import com.onalog.discovery.lead.model.ProviderResult;
import com.onalog.discovery.lead.search.ProviderStrategy;
import com.onalog.discovery.lead.search.ProviderTier;
import com.onalog.discovery.lead.search.SearchQuery;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Programmable Search. The API returns at most ten items per call, so pages are walked with
 * {@code start} until the target is met or a short page arrives.
 */
@Component
public class GoogleCustomSearchProvider implements ProviderStrategy {
    public static final String NAME = "google_cse";
    private static final int PAGE_SIZE = 10;
    private static final int MAX_PAGES = 5;

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    public GoogleCustomSearchProvider(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        DiscoveryProperties properties
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderTier tier() {
        return ProviderTier.WEB;
    }

    @Override
    public ProviderResult attempt(SearchQuery query) {
        DiscoveryProperties.Providers providers = properties.getProviders();
        if (isBlank(providers.getGoogleCseKey()) || isBlank(providers.getGoogleCseId())) {
            return ProviderResult.failure(NAME, ProviderFailure.AUTH_MISSING, "google custom search not configured");
        }
        Duration timeout = Duration.ofSeconds(properties.getSearch().getWebSearchTimeoutSeconds());
        String q = ProviderResponses.encode(query.withGeography(query.query()));
        int pages = Math.min(MAX_PAGES, (query.resultTarget() + PAGE_SIZE - 1) / PAGE_SIZE);
        List<LeadCandidate> candidates = new ArrayList<>();
        for (int page = 0; page < pages; page++) {
            String url = providers.getGoogleCseUrl()
                + "?key=" + ProviderResponses.encode(providers.getGoogleCseKey())
                + "&cx=" + ProviderResponses.encode(providers.getGoogleCseId())
                + "&q=" + q
                + "&num=" + PAGE_SIZE
                + "&start=" + (page * PAGE_SIZE + 1);
            HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.ACCEPT_JSON, timeout);
            if (!fetch.isSuccessful()) {
                if (candidates.isEmpty()) {
                    return ProviderResponses.failureOf(NAME, fetch);
                }
                break;
            }
            int itemCount;
            try {
                JsonNode items = objectMapper.readTree(fetch.body()).path("items");
                itemCount = items.size();
                for (JsonNode item : items) {
                    String link = item.path("link").asText("");
                    if (!link.startsWith("http") || DirectorySites.isDirectorySite(link)) {
                        continue;
                    }
                    candidates.add(LeadCandidate.of(item.path("title").asText(""), link, item.path("snippet").asText(""), NAME));
                }
            } catch (JsonProcessingException e) {
                return ProviderResult.failure(NAME, ProviderFailure.ERROR, "invalid google custom search payload");
            }
            if (itemCount < PAGE_SIZE) {
                break;
            }
        }
        return ProviderResult.success(NAME, candidates);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
