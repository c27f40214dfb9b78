package com.onalog.discovery.lead.search;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.collab.TermExpansionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a user query into a short list of search terms: the original first, then ontology labels for the
 * country's language, model-suggested variants, plural forms and accent-free spellings.
 */
@Service
public class QueryExpansionService {
    private static final Logger log = LoggerFactory.getLogger(QueryExpansionService.class);

    private final TermExpansionClient termExpansionClient;
    private final DiscoveryProperties properties;
    private final Map<String, CachedTerms> cache = new ConcurrentHashMap<>();

    public QueryExpansionService(TermExpansionClient termExpansionClient, DiscoveryProperties properties) {
        this.termExpansionClient = termExpansionClient;
        this.properties = properties;
    }

    public List<String> expand(String query, String country) {
        String key = (query == null ? "" : query.trim().toLowerCase(Locale.ROOT)) + "|"
            + (country == null ? "" : country.trim().toLowerCase(Locale.ROOT));
        CachedTerms cached = cache.get(key);
        if (cached != null && cached.expiresAt().isAfter(Instant.now())) {
            return cached.terms();
        }
        List<String> terms = computeTerms(query, country);
        cache.put(key, new CachedTerms(
            terms,
            Instant.now().plus(Duration.ofMinutes(properties.getSearch().getExpansionCacheMinutes()))
        ));
        return terms;
    }

    List<String> computeTerms(String query, String country) {
        String original = query == null ? "" : query.trim();
        String locale = CountryNames.localeOf(country);
        int max = properties.getSearch().getMaxExpandedTerms();
        Map<String, String> terms = new LinkedHashMap<>();
        add(terms, original);

        List<ConceptOntology.Concept> concepts = ConceptOntology.match(original);
        for (ConceptOntology.Concept concept : concepts) {
            concept.labelsFor(locale).forEach(label -> add(terms, label));
        }
        for (String variant : modelVariants(original, locale)) {
            add(terms, variant);
        }
        for (ConceptOntology.Concept concept : concepts) {
            concept.pluralsFor(locale).forEach(plural -> add(terms, plural));
        }
        for (String term : new ArrayList<>(terms.values())) {
            String folded = ConceptOntology.fold(term);
            if (!folded.equals(term.toLowerCase(Locale.ROOT))) {
                add(terms, folded);
            }
        }
        List<String> ordered = new ArrayList<>(terms.values());
        return List.copyOf(ordered.size() > max ? ordered.subList(0, max) : ordered);
    }

    private List<String> modelVariants(String query, String locale) {
        try {
            List<String> variants = termExpansionClient.expand(query, locale);
            return variants == null ? List.of() : variants;
        } catch (RuntimeException e) {
            log.warn("Term expansion failed for '{}'", query, e);
            return List.of();
        }
    }

    private static void add(Map<String, String> terms, String term) {
        if (term == null || term.isBlank()) {
            return;
        }
        terms.putIfAbsent(term.trim().toLowerCase(Locale.ROOT), term.trim());
    }

    private record CachedTerms(List<String> terms, Instant expiresAt) {
    }
}
