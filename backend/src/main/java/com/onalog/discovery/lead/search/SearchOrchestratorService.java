package com.onalog.discovery.lead.search;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.collab.IntentClassifier;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.ProviderResult;
import com.onalog.discovery.lead.model.SearchOutcome;
import com.onalog.discovery.lead.search.provider.BingSearchProvider;
import com.onalog.discovery.lead.search.provider.DuckDuckGoProvider;
import com.onalog.discovery.lead.search.provider.GoogleCustomSearchProvider;
import com.onalog.discovery.lead.search.provider.GooglePlacesProvider;
import com.onalog.discovery.lead.search.provider.NominatimProvider;
import com.onalog.discovery.lead.search.provider.OverpassProvider;
import com.onalog.discovery.lead.search.provider.SearxngProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gathers candidate businesses for a query: free providers in parallel, then paid and scrape fallbacks while the
 * result count stays under the escalation threshold, then tier-ordered merge and directory expansion.
 */
@Service
public class SearchOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestratorService.class);
    public static final String TELEMETRY_PAID_INVOKED = "paidInvoked";
    public static final String TELEMETRY_SCRAPE_INVOKED = "scrapeInvoked";
    public static final String TELEMETRY_DIGITAL_INTENT = "digitalIntent";
    public static final String TELEMETRY_EXPANDED_TERMS = "expandedTerms";
    public static final String TELEMETRY_DIRECTORIES_EXPANDED = "directoriesExpanded";
    public static final String TELEMETRY_OVERPASS_RETRY = "overpassRetry";

    private final OverpassProvider overpassProvider;
    private final NominatimProvider nominatimProvider;
    private final SearxngProvider searxngProvider;
    private final BingSearchProvider bingSearchProvider;
    private final GoogleCustomSearchProvider googleCustomSearchProvider;
    private final GooglePlacesProvider googlePlacesProvider;
    private final DuckDuckGoProvider duckDuckGoProvider;
    private final ProviderCascade providerCascade;
    private final QueryExpansionService queryExpansionService;
    private final DirectoryExpander directoryExpander;
    private final IntentClassifier intentClassifier;
    private final DiscoveryProperties properties;
    private final Map<String, Boolean> intentCache = new ConcurrentHashMap<>();

    public SearchOrchestratorService(
        OverpassProvider overpassProvider,
        NominatimProvider nominatimProvider,
        SearxngProvider searxngProvider,
        BingSearchProvider bingSearchProvider,
        GoogleCustomSearchProvider googleCustomSearchProvider,
        GooglePlacesProvider googlePlacesProvider,
        DuckDuckGoProvider duckDuckGoProvider,
        ProviderCascade providerCascade,
        QueryExpansionService queryExpansionService,
        DirectoryExpander directoryExpander,
        IntentClassifier intentClassifier,
        DiscoveryProperties properties
    ) {
        this.overpassProvider = overpassProvider;
        this.nominatimProvider = nominatimProvider;
        this.searxngProvider = searxngProvider;
        this.bingSearchProvider = bingSearchProvider;
        this.googleCustomSearchProvider = googleCustomSearchProvider;
        this.googlePlacesProvider = googlePlacesProvider;
        this.duckDuckGoProvider = duckDuckGoProvider;
        this.providerCascade = providerCascade;
        this.queryExpansionService = queryExpansionService;
        this.directoryExpander = directoryExpander;
        this.intentClassifier = intentClassifier;
        this.properties = properties;
    }

    public SearchOutcome search(String query, String country, String location, int resultTarget) {
        DiscoveryProperties.Search search = properties.getSearch();
        Map<String, Object> telemetry = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        Map<ProviderTier, List<ProviderResult>> resultsByTier = new EnumMap<>(ProviderTier.class);

        boolean digitalIntent = digitalIntent(query);
        List<String> terms = queryExpansionService.expand(query, country);
        telemetry.put(TELEMETRY_DIGITAL_INTENT, digitalIntent);
        telemetry.put(TELEMETRY_EXPANDED_TERMS, terms);
        SearchQuery searchQuery = new SearchQuery(query, terms, country, location, resultTarget);

        List<ProviderStrategy> freeTier = new ArrayList<>(List.of(overpassProvider, nominatimProvider));
        if (searxngProvider.isConfigured()) {
            freeTier.add(searxngProvider);
        }
        if (digitalIntent) {
            freeTier.add(bingSearchProvider);
            freeTier.add(googleCustomSearchProvider);
        }
        Duration tierTimeout = Duration.ofSeconds(search.getTierTimeoutSeconds());
        Duration webTimeout = Duration.ofSeconds(search.getWebSearchTimeoutSeconds());
        List<ProviderResult> free = providerCascade.runParallel(
            freeTier,
            searchQuery,
            strategy -> strategy.tier() == ProviderTier.WEB ? webTimeout : tierTimeout
        );
        for (int i = 0; i < freeTier.size(); i++) {
            record(freeTier.get(i), free.get(i), resultsByTier, telemetry, notes);
        }

        int threshold = escalationThreshold(resultTarget);
        int total = SearchResultMerger.merge(resultsByTier).size();
        boolean paidInvoked = false;
        boolean scrapeInvoked = false;
        if (total < threshold) {
            paidInvoked = true;
            log.info("Free providers found {} of {} needed for '{}'; escalating to paid search", total, threshold, query);
            ProviderResult paid = providerCascade.run(googlePlacesProvider, searchQuery, tierTimeout);
            record(googlePlacesProvider, paid, resultsByTier, telemetry, notes);
            total = SearchResultMerger.merge(resultsByTier).size();
        }
        if (total < threshold) {
            scrapeInvoked = true;
            ProviderResult scraped = providerCascade.run(duckDuckGoProvider, searchQuery, scrapeBound());
            record(duckDuckGoProvider, scraped, resultsByTier, telemetry, notes);
            total = SearchResultMerger.merge(resultsByTier).size();
        }
        if (total == 0) {
            String shortQuery = firstWords(query, 2);
            if (!shortQuery.isEmpty() && !shortQuery.equalsIgnoreCase(query.trim())) {
                log.info("No results for '{}'; retrying Overpass with '{}'", query, shortQuery);
                ProviderResult retry = providerCascade.run(overpassProvider, searchQuery.withQuery(shortQuery), tierTimeout);
                telemetry.put(TELEMETRY_OVERPASS_RETRY, retry.count());
                if (!retry.isFailure()) {
                    resultsByTier.computeIfAbsent(ProviderTier.GEOGRAPHIC, ignored -> new ArrayList<>()).add(retry);
                }
            }
        }
        telemetry.put(TELEMETRY_PAID_INVOKED, paidInvoked);
        telemetry.put(TELEMETRY_SCRAPE_INVOKED, scrapeInvoked);

        List<LeadCandidate> merged = SearchResultMerger.merge(resultsByTier);
        DirectoryExpander.Expansion expansion = directoryExpander.expand(merged, resultTarget);
        telemetry.put(TELEMETRY_DIRECTORIES_EXPANDED, expansion.directoriesExpanded());

        List<LeadCandidate> results = expansion.candidates();
        String shortfall = null;
        if (results.size() < resultTarget) {
            shortfall = notes.isEmpty()
                ? "found " + results.size() + " of " + resultTarget + " requested results"
                : String.join("; ", notes);
        }
        log.info(
            "Search '{}' ({}, {}) produced {} candidates (paid={}, scrape={})",
            query,
            country,
            location,
            results.size(),
            paidInvoked,
            scrapeInvoked
        );
        return new SearchOutcome(results, telemetry, shortfall);
    }

    int escalationThreshold(int resultTarget) {
        DiscoveryProperties.Search search = properties.getSearch();
        return Math.max(search.getEscalationFloor(), (int) Math.ceil(search.getEscalationRatio() * resultTarget));
    }

    boolean digitalIntent(String query) {
        String key = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return intentCache.computeIfAbsent(key, ignored -> {
            try {
                return intentClassifier.classifyDigitalIntent(query);
            } catch (RuntimeException e) {
                log.warn("Intent classification failed for '{}'", query, e);
                return false;
            }
        });
    }

    private Duration scrapeBound() {
        DiscoveryProperties.Search search = properties.getSearch();
        long backoff = search.getScrapeBackoffSeconds().stream().mapToLong(Integer::longValue).sum();
        long attempts = Math.max(1, search.getScrapeBackoffSeconds().size());
        return Duration.ofSeconds(backoff + attempts * search.getProviderTimeoutSeconds());
    }

    private static void record(
        ProviderStrategy strategy,
        ProviderResult result,
        Map<ProviderTier, List<ProviderResult>> resultsByTier,
        Map<String, Object> telemetry,
        List<String> notes
    ) {
        telemetry.put(strategy.name(), result.count());
        if (result.isFailure()) {
            notes.add(strategy.name() + " " + result.failure().name().toLowerCase(Locale.ROOT)
                + (result.message() == null ? "" : ": " + result.message()));
            return;
        }
        resultsByTier.computeIfAbsent(strategy.tier(), ignored -> new ArrayList<>()).add(result);
    }

    static String firstWords(String query, int count) {
        if (query == null || query.isBlank()) {
            return "";
        }
        String[] words = query.trim().split("\\s+");
        return String.join(" ", Arrays.copyOf(words, Math.min(count, words.length)));
    }
}
