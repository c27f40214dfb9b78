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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Self-hosted metasearch. Configured instances are tried in order; the first one that returns results wins.
 */
@Component
public class SearxngProvider implements ProviderStrategy {
    public static final String NAME = "searxng";
    private static final Logger log = LoggerFactory.getLogger(SearxngProvider.class);

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    public SearxngProvider(PoliteHttpClient httpClient, ObjectMapper objectMapper, DiscoveryProperties properties) {
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
        return ProviderTier.METASEARCH;
    }

    public boolean isConfigured() {
        return !properties.getProviders().getSearxngUrls().isEmpty();
    }

    @Override
    public ProviderResult attempt(SearchQuery query) {
        List<String> instances = properties.getProviders().getSearxngUrls();
        if (instances.isEmpty()) {
            return ProviderResult.failure(NAME, ProviderFailure.DISABLED, "no searxng instances configured");
        }
        Duration timeout = Duration.ofSeconds(properties.getSearch().getProviderTimeoutSeconds());
        String q = query.withGeography(query.query());
        ProviderResult firstFailure = null;
        for (String instance : instances) {
            String base = instance.replaceAll("/+$", "");
            HttpFetchResult fetch = httpClient.get(
                base + "/search?format=json&categories=general&q=" + ProviderResponses.encode(q),
                PoliteHttpClient.ACCEPT_JSON,
                timeout
            );
            if (!fetch.isSuccessful()) {
                log.debug("SearXNG instance {} failed: {}", base, fetch.describeFailure());
                if (firstFailure == null) {
                    firstFailure = ProviderResponses.failureOf(NAME, fetch);
                }
                continue;
            }
            try {
                List<LeadCandidate> candidates = parse(objectMapper.readTree(fetch.body()), query.resultTarget());
                if (!candidates.isEmpty()) {
                    return ProviderResult.success(NAME, candidates);
                }
            } catch (JsonProcessingException e) {
                if (firstFailure == null) {
                    firstFailure = ProviderResult.failure(NAME, ProviderFailure.ERROR, "invalid searxng payload");
                }
            }
        }
        return firstFailure != null ? firstFailure : ProviderResult.success(NAME, List.of());
    }

    private List<LeadCandidate> parse(JsonNode root, int max) {
        List<LeadCandidate> candidates = new ArrayList<>();
        for (JsonNode item : root.path("results")) {
            String url = item.path("url").asText("");
            String title = item.path("title").asText("");
            if (!url.startsWith("http") || title.isBlank() || DirectorySites.isDirectorySite(url)) {
                continue;
            }
            candidates.add(LeadCandidate.of(title, url, item.path("content").asText(""), NAME));
            if (candidates.size() >= max) {
                break;
            }
        }
        return candidates;
    }
}
