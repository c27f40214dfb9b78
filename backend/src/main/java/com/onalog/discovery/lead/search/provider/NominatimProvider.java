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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Geocoded point-of-interest lookup. Only places of business-like OSM classes are kept; administrative areas
 * and roads that happen to share the query's name are dropped.
 */
@Component
public class NominatimProvider implements ProviderStrategy {
    public static final String NAME = "nominatim";
    private static final Set<String> BUSINESS_CLASSES = Set.of(
        "amenity", "shop", "tourism", "office", "healthcare", "craft", "leisure", "club"
    );

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    public NominatimProvider(PoliteHttpClient httpClient, ObjectMapper objectMapper, DiscoveryProperties properties) {
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
        return ProviderTier.GEOGRAPHIC;
    }

    @Override
    public ProviderResult attempt(SearchQuery query) {
        String baseUrl = properties.getProviders().getNominatimUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return ProviderResult.failure(NAME, ProviderFailure.DISABLED, "nominatim url not configured");
        }
        Duration timeout = Duration.ofSeconds(properties.getSearch().getProviderTimeoutSeconds());
        int limit = Math.min(50, query.resultTarget());
        Map<String, LeadCandidate> byPlace = new LinkedHashMap<>();
        ProviderResult lastFailure = null;
        boolean anySuccess = false;
        for (String term : query.terms()) {
            String url = baseUrl
                + "?q=" + ProviderResponses.encode(query.withGeography(term))
                + "&format=json&limit=" + limit + "&addressdetails=1&extratags=1";
            HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.ACCEPT_JSON, timeout);
            if (!fetch.isSuccessful()) {
                lastFailure = ProviderResponses.failureOf(NAME, fetch);
                continue;
            }
            try {
                parsePlaces(objectMapper.readTree(fetch.body()), byPlace);
                anySuccess = true;
            } catch (JsonProcessingException e) {
                lastFailure = ProviderResult.failure(NAME, ProviderFailure.ERROR, "invalid nominatim payload");
            }
            if (byPlace.size() >= query.resultTarget()) {
                break;
            }
        }
        if (!anySuccess && lastFailure != null) {
            return lastFailure;
        }
        return ProviderResult.success(NAME, new ArrayList<>(byPlace.values()));
    }

    private void parsePlaces(JsonNode root, Map<String, LeadCandidate> out) {
        if (!root.isArray()) {
            return;
        }
        for (JsonNode place : root) {
            if (!BUSINESS_CLASSES.contains(place.path("class").asText(""))) {
                continue;
            }
            String key = place.path("osm_type").asText() + "/" + place.path("osm_id").asText();
            if (out.containsKey(key)) {
                continue;
            }
            String displayName = place.path("display_name").asText("");
            String name = place.path("name").asText("").trim();
            if (name.isEmpty()) {
                int comma = displayName.indexOf(',');
                name = (comma > 0 ? displayName.substring(0, comma) : displayName).trim();
            }
            if (name.length() <= 2) {
                continue;
            }
            JsonNode extra = place.path("extratags");
            String website = ProviderResponses.withScheme(
                extra.path("website").asText(extra.path("contact:website").asText(""))
            );
            if (website != null && DirectorySites.isDirectorySite(website)) {
                continue;
            }
            String phone = extra.path("phone").asText(extra.path("contact:phone").asText(""));
            out.put(key, new LeadCandidate(
                name,
                website != null ? website : "https://www.openstreetmap.org/" + key,
                displayName,
                phone.isBlank() ? null : phone,
                displayName.isBlank() ? null : displayName,
                "osm:" + key,
                NAME
            ));
        }
    }
}
