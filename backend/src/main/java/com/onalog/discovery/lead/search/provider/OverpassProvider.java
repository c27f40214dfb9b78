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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * OpenStreetMap structured search. Known business words map to OSM tags; every term also becomes a
 * case-insensitive name match inside the location (or country) area.
 */
@Component
public class OverpassProvider implements ProviderStrategy {
    public static final String NAME = "overpass";
    private static final Logger log = LoggerFactory.getLogger(OverpassProvider.class);
    private static final Map<String, String> TAGS_BY_WORD = new LinkedHashMap<>();

    static {
        TAGS_BY_WORD.put("bank", "amenity=bank");
        TAGS_BY_WORD.put("restaurant", "amenity=restaurant");
        TAGS_BY_WORD.put("cafe", "amenity=cafe");
        TAGS_BY_WORD.put("coffee", "amenity=cafe");
        TAGS_BY_WORD.put("bar", "amenity=bar");
        TAGS_BY_WORD.put("pharmacy", "amenity=pharmacy");
        TAGS_BY_WORD.put("hospital", "amenity=hospital");
        TAGS_BY_WORD.put("clinic", "amenity=clinic");
        TAGS_BY_WORD.put("hotel", "tourism=hotel");
        TAGS_BY_WORD.put("supermarket", "shop=supermarket");
        TAGS_BY_WORD.put("gelato", "amenity=ice_cream");
        TAGS_BY_WORD.put("ice cream", "amenity=ice_cream");
        TAGS_BY_WORD.put("company", "office=company");
        TAGS_BY_WORD.put("agency", "office=company");
        TAGS_BY_WORD.put("firm", "office=company");
        TAGS_BY_WORD.put("real estate", "office=estate_agent");
        TAGS_BY_WORD.put("estate agent", "office=estate_agent");
        TAGS_BY_WORD.put("realtor", "office=estate_agent");
        TAGS_BY_WORD.put("imobili", "office=estate_agent");
        TAGS_BY_WORD.put("inmobili", "office=estate_agent");
    }

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DiscoveryProperties properties;

    public OverpassProvider(PoliteHttpClient httpClient, ObjectMapper objectMapper, DiscoveryProperties properties) {
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
        List<String> endpoints = properties.getProviders().getOverpassUrls();
        if (endpoints.isEmpty()) {
            return ProviderResult.failure(NAME, ProviderFailure.DISABLED, "no overpass endpoints configured");
        }
        Duration timeout = Duration.ofSeconds(properties.getSearch().getProviderTimeoutSeconds());
        Map<String, LeadCandidate> byElement = new LinkedHashMap<>();
        ProviderResult lastFailure = null;
        boolean anySuccess = false;
        for (String term : query.terms()) {
            String ql = buildQuery(term, query.location(), query.countryName(), query.resultTarget());
            HttpFetchResult fetch = null;
            for (String endpoint : endpoints) {
                fetch = httpClient.get(
                    endpoint + "?data=" + ProviderResponses.encode(ql),
                    PoliteHttpClient.ACCEPT_JSON,
                    timeout
                );
                if (fetch.isSuccessful()) {
                    break;
                }
                log.debug("Overpass endpoint {} failed: {}", endpoint, fetch.describeFailure());
            }
            if (fetch == null || !fetch.isSuccessful()) {
                lastFailure = fetch == null ? null : ProviderResponses.failureOf(NAME, fetch);
                continue;
            }
            try {
                parseElements(objectMapper.readTree(fetch.body()), byElement);
                anySuccess = true;
            } catch (JsonProcessingException e) {
                lastFailure = ProviderResult.failure(NAME, ProviderFailure.ERROR, "invalid overpass payload");
            }
            if (byElement.size() >= query.resultTarget()) {
                break;
            }
        }
        if (!anySuccess && lastFailure != null) {
            return lastFailure;
        }
        List<LeadCandidate> candidates = new ArrayList<>(byElement.values());
        return ProviderResult.success(
            NAME,
            candidates.size() > query.resultTarget() ? candidates.subList(0, query.resultTarget()) : candidates
        );
    }

    static String buildQuery(String term, String location, String countryName, int limit) {
        String areaName = location != null && !location.isBlank() ? location.trim() : countryName;
        String area = areaName == null || areaName.isBlank()
            ? "area[\"name\"=\"World\"]->.a;"
            : "area['name'='" + escape(areaName) + "']->.a;";
        StringBuilder union = new StringBuilder();
        for (String tag : tagsFor(term)) {
            String[] kv = tag.split("=", 2);
            for (String type : List.of("node", "way", "relation")) {
                union.append("  ").append(type).append("['").append(kv[0]).append("'='").append(kv[1])
                    .append("'](area.a);\n");
            }
        }
        String name = sanitizeName(term);
        if (!name.isEmpty()) {
            for (String type : List.of("node", "way", "relation")) {
                union.append("  ").append(type).append("['name'~'").append(name).append("', i](area.a);\n");
            }
        }
        return "[out:json][timeout:25];\n"
            + area + "\n"
            + "(\n" + union + ");\n"
            + "out center tags " + Math.max(10, Math.min(200, limit)) + ";";
    }

    static Set<String> tagsFor(String term) {
        Set<String> tags = new LinkedHashSet<>();
        String lower = term == null ? "" : term.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : TAGS_BY_WORD.entrySet()) {
            if (lower.contains(entry.getKey())) {
                tags.add(entry.getValue());
            }
        }
        if (tags.contains("amenity=hospital")) {
            tags.add("healthcare=hospital");
        }
        return tags;
    }

    private void parseElements(JsonNode root, Map<String, LeadCandidate> out) {
        JsonNode elements = root.path("elements");
        for (JsonNode element : elements) {
            JsonNode tags = element.path("tags");
            String name = tags.path("name").asText("").trim();
            if (name.length() <= 2) {
                continue;
            }
            String key = element.path("type").asText() + "/" + element.path("id").asText();
            if (out.containsKey(key)) {
                continue;
            }
            String website = ProviderResponses.withScheme(firstText(tags, "website", "contact:website", "url"));
            if (website != null && DirectorySites.isDirectorySite(website)) {
                continue;
            }
            List<String> addressParts = new ArrayList<>();
            String street = firstText(tags, "addr:street");
            String number = firstText(tags, "addr:housenumber");
            if (street != null) {
                addressParts.add(number == null ? street : street + " " + number);
            }
            for (String part : new String[] {
                firstText(tags, "addr:city", "addr:town", "addr:village"),
                firstText(tags, "addr:state"),
                firstText(tags, "addr:country")
            }) {
                if (part != null) {
                    addressParts.add(part);
                }
            }
            String address = addressParts.isEmpty() ? null : String.join(", ", addressParts);
            String link = website != null ? website : "https://www.openstreetmap.org/" + key;
            out.put(key, new LeadCandidate(
                name,
                link,
                address == null ? "" : address,
                firstText(tags, "phone", "contact:phone", "phone:mobile"),
                address,
                "osm:" + key,
                NAME
            ));
        }
    }

    private static String firstText(JsonNode tags, String... fields) {
        for (String field : fields) {
            String value = tags.path(field).asText("").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String sanitizeName(String term) {
        if (term == null) {
            return "";
        }
        return term.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N} \\-]", "")
            .replaceAll("\\s+", " ")
            .trim();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
