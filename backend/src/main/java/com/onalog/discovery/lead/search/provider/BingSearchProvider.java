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
import java.util.Map;

@Component
public class BingSearchProvider implements ProviderStrategy {
    public static final String NAME = "bing";
    static final String KEY_HEADER = "Ocp-Apim-Subscription-Key";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    public BingSearchProvider(PoliteHttpClient httpClient, ObjectMapper objectMapper, DiscoveryProperties properties) {
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
        String apiKey = properties.getProviders().getBingApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return ProviderResult.failure(NAME, ProviderFailure.AUTH_MISSING, "bing api key not configured");
        }
        String url = properties.getProviders().getBingUrl()
            + "?q=" + ProviderResponses.encode(query.withGeography(query.query()))
            + "&count=" + Math.min(50, query.resultTarget())
            + "&responseFilter=Webpages";
        HttpFetchResult fetch = httpClient.get(
            url,
            PoliteHttpClient.ACCEPT_JSON,
            Duration.ofSeconds(properties.getSearch().getWebSearchTimeoutSeconds()),
            Map.of(KEY_HEADER, apiKey)
        );
        if (!fetch.isSuccessful()) {
            return ProviderResponses.failureOf(NAME, fetch);
        }
        try {
            JsonNode root = objectMapper.readTree(fetch.body());
            List<LeadCandidate> candidates = new ArrayList<>();
            for (JsonNode page : root.path("webPages").path("value")) {
                String link = page.path("url").asText("");
                if (!link.startsWith("http") || DirectorySites.isDirectorySite(link)) {
                    continue;
                }
                candidates.add(LeadCandidate.of(page.path("name").asText(""), link, page.path("snippet").asText(""), NAME));
            }
            return ProviderResult.success(NAME, candidates);
        } catch (JsonProcessingException e) {
            return ProviderResult.failure(NAME, ProviderFailure.ERROR, "invalid bing payload");
        }
    }
}
