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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Paid text search against Google Places. Places without a website keep a {@code places:<id>} link so the
 * pipeline can still record them from the provider's phone and address.
 */
@Component
public class GooglePlacesProvider implements ProviderStrategy {
    public static final String NAME = "google_places";
    private static final int PAGE_SIZE = 20;
    private static final int MAX_PAGES = 3;
    // next_page_token only becomes valid a moment after it is issued
    private static final Duration PAGE_TOKEN_DELAY = Duration.ofSeconds(2);

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public GooglePlacesProvider(PoliteHttpClient httpClient, ObjectMapper objectMapper, DiscoveryProperties properties) {
        this(httpClient, objectMapper, properties, Sleeper.SYSTEM);
    }

    GooglePlacesProvider(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        DiscoveryProperties properties,
        Sleeper sleeper
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderTier tier() {
        return ProviderTier.PAID;
    }

    @Override
    public ProviderResult attempt(SearchQuery query) {
        DiscoveryProperties.Providers providers = properties.getProviders();
        if (!providers.isPlacesEnabled()) {
            return ProviderResult.failure(NAME, ProviderFailure.DISABLED, "google places disabled");
        }
        String apiKey = providers.getPlacesApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return ProviderResult.failure(NAME, ProviderFailure.AUTH_MISSING, "google places api key not configured");
        }
        Duration timeout = Duration.ofSeconds(properties.getSearch().getProviderTimeoutSeconds());
        String baseUrl = providers.getPlacesUrl()
            + "?query=" + ProviderResponses.encode(query.withGeography(query.query()))
            + "&key=" + ProviderResponses.encode(apiKey);
        int pages = Math.min(MAX_PAGES, (query.resultTarget() + PAGE_SIZE - 1) / PAGE_SIZE);
        List<LeadCandidate> candidates = new ArrayList<>();
        String pageToken = null;
        for (int page = 0; page < pages; page++) {
            if (pageToken != null && !sleeper.sleep(PAGE_TOKEN_DELAY)) {
                break;
            }
            String url = pageToken == null ? baseUrl : baseUrl + "&pagetoken=" + ProviderResponses.encode(pageToken);
            HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.ACCEPT_JSON, timeout);
            if (!fetch.isSuccessful()) {
                return candidates.isEmpty() ? ProviderResponses.failureOf(NAME, fetch) : ProviderResult.success(NAME, candidates);
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(fetch.body());
            } catch (JsonProcessingException e) {
                return ProviderResult.failure(NAME, ProviderFailure.ERROR, "invalid google places payload");
            }
            String status = root.path("status").asText("");
            if ("REQUEST_DENIED".equals(status)) {
                return ProviderResult.failure(NAME, ProviderFailure.AUTH_MISSING, errorMessage(root, status));
            }
            if ("OVER_QUERY_LIMIT".equals(status)) {
                return ProviderResult.failure(NAME, ProviderFailure.RATE_LIMITED, errorMessage(root, status));
            }
            if (!"OK".equals(status) && !"ZERO_RESULTS".equals(status)) {
                return ProviderResult.failure(NAME, ProviderFailure.ERROR, errorMessage(root, status));
            }
            for (JsonNode place : root.path("results")) {
                LeadCandidate candidate = toCandidate(place);
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
            pageToken = root.path("next_page_token").asText(null);
            if (pageToken == null || pageToken.isBlank()) {
                break;
            }
        }
        return ProviderResult.success(NAME, candidates);
    }

    private LeadCandidate toCandidate(JsonNode place) {
        String name = place.path("name").asText("").trim();
        String placeId = place.path("place_id").asText("").trim();
        if (name.isEmpty() || placeId.isEmpty()) {
            return null;
        }
        String website = ProviderResponses.withScheme(place.path("website").asText(""));
        if (website != null && DirectorySites.isDirectorySite(website)) {
            website = null;
        }
        String address = place.path("formatted_address").asText("");
        String phone = place.path("international_phone_number").asText(place.path("formatted_phone_number").asText(""));
        return new LeadCandidate(
            name,
            website != null ? website : "places:" + placeId,
            address,
            phone.isBlank() ? null : phone,
            address.isBlank() ? null : address,
            placeId,
            NAME
        );
    }

    private static String errorMessage(JsonNode root, String status) {
        String message = root.path("error_message").asText("");
        return message.isBlank() ? "places status " + status : message;
    }
}
