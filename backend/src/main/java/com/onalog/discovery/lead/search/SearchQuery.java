package com.onalog.discovery.lead.search;

import java.util.ArrayList;
import java.util.List;

/**
 * One provider request: the raw query, its expanded search terms (original first) and the geography filters.
 */
public record SearchQuery(
    String query,
    List<String> terms,
    String country,
    String location,
    int resultTarget
) {
    public SearchQuery {
        terms = terms == null || terms.isEmpty() ? List.of(query) : List.copyOf(terms);
    }

    public static SearchQuery of(String query, String country, String location, int resultTarget) {
        return new SearchQuery(query, List.of(query), country, location, resultTarget);
    }

    public SearchQuery withQuery(String replacement) {
        return new SearchQuery(replacement, List.of(replacement), country, location, resultTarget);
    }

    public String countryName() {
        return CountryNames.nameOf(country);
    }

    /**
     * Query text with location and country name appended, as free-text engines expect it.
     */
    public String withGeography(String term) {
        List<String> parts = new ArrayList<>();
        parts.add(term);
        if (location != null && !location.isBlank()) {
            parts.add(location.trim());
        }
        String countryName = countryName();
        if (countryName != null) {
            parts.add(countryName);
        }
        return String.join(" ", parts);
    }
}
