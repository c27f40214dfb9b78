package com.onalog.discovery.lead.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.extract.JsonLdReader;
import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.ClassificationResult;
import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Scores a page as first-party business site (positive) or aggregator/listing (negative). The score is advisory:
 * callers hard-reject only at or below {@link DiscoveryProperties.Classifier#getRejectThreshold()}.
 */
@Service
public class DirectoryClassifier {
    private static final Logger log = LoggerFactory.getLogger(DirectoryClassifier.class);
    private static final Pattern LISTING_PATH = Pattern.compile(
        "(category|tags|companies|agencies|directory|list|locations|explore)"
    );
    private static final Pattern LISTICLE_PATH = Pattern.compile("top-\\d+|best|list-of|the-\\d+-best");
    private static final Pattern LISTICLE_TITLE = Pattern.compile(
        "\\btop\\s+\\d+|\\b\\d+\\s+best\\b|\\blist of\\b|\\bdirectory\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final int ITEM_LIST_MIN_ENTRIES = 5;
    private static final int MIN_EXTERNAL_HOSTS = 5;

    private final PoliteHttpClient httpClient;
    private final JsonLdReader jsonLdReader;
    private final DiscoveryProperties properties;
    private final Map<String, CachedClassification> cache = new ConcurrentHashMap<>();

    public DirectoryClassifier(PoliteHttpClient httpClient, JsonLdReader jsonLdReader, DiscoveryProperties properties) {
        this.httpClient = httpClient;
        this.jsonLdReader = jsonLdReader;
        this.properties = properties;
    }

    public ClassificationResult classify(String url) {
        String key = cacheKey(url);
        CachedClassification cached = cache.get(key);
        if (cached != null && cached.expiresAt().isAfter(Instant.now())) {
            return cached.result();
        }
        HttpFetchResult fetch = httpClient.get(
            url,
            PoliteHttpClient.ACCEPT_HTML,
            Duration.ofSeconds(properties.getClassifier().getFetchTimeoutSeconds())
        );
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("Classifier fetch failed for {}: {}", url, fetch.describeFailure());
            return ClassificationResult.fallback();
        }
        return classify(url, Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested()));
    }

    public ClassificationResult classify(String url, Document document) {
        int score = 0;
        List<String> reasons = new ArrayList<>();
        String path = DirectorySites.pathOf(url);

        if (LISTING_PATH.matcher(path).find()) {
            score -= 2;
            reasons.add("listing_path");
        }
        if (LISTICLE_PATH.matcher(path).find()) {
            score -= 2;
            reasons.add("listicle_path");
        }
        String title = pageTitle(document);
        if (title != null && LISTICLE_TITLE.matcher(title).find()) {
            score -= 2;
            reasons.add("listicle_title");
        }

        boolean itemList = false;
        boolean business = false;
        for (JsonNode node : jsonLdReader.read(document)) {
            if (JsonLdReader.hasType(node, "ItemList") || JsonLdReader.hasType(node, "CollectionPage")) {
                itemList = true;
            }
            JsonNode elements = node.get("itemListElement");
            if (elements != null && elements.isArray() && elements.size() >= ITEM_LIST_MIN_ENTRIES) {
                itemList = true;
            }
            if (JsonLdReader.isBusinessEntity(node)) {
                business = true;
            }
        }
        if (itemList) {
            score -= 3;
            reasons.add("item_list_schema");
        }
        if (business) {
            score += 2;
            reasons.add("business_schema");
        }

        LinkProfile links = linkProfile(url, document);
        if (links.distinctExternalHosts() >= MIN_EXTERNAL_HOSTS && links.external() > links.internal()) {
            score -= 2;
            reasons.add("external_link_ratio");
        }

        ClassificationResult result = new ClassificationResult(score, List.copyOf(reasons));
        cache.put(cacheKey(url), new CachedClassification(
            result,
            Instant.now().plus(Duration.ofMinutes(properties.getClassifier().getCacheMinutes()))
        ));
        return result;
    }

    public boolean isRejected(ClassificationResult result) {
        return result != null && result.isRejected(properties.getClassifier().getRejectThreshold());
    }

    static LinkProfile linkProfile(String pageUrl, Document document) {
        String pageHost = HostnameNormalizer.normalize(pageUrl);
        int internal = 0;
        int external = 0;
        Set<String> hosts = new HashSet<>();
        if (document == null) {
            return new LinkProfile(0, 0, 0);
        }
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                href = anchor.attr("href");
            }
            String lower = href.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                if (!lower.startsWith("mailto:") && !lower.startsWith("tel:") && !lower.startsWith("javascript:")) {
                    internal++;
                }
                continue;
            }
            String host = HostnameNormalizer.normalize(href);
            if (host.isEmpty() || host.equals(pageHost)) {
                internal++;
            } else {
                external++;
                hosts.add(host);
            }
        }
        return new LinkProfile(internal, external, hosts.size());
    }

    private String pageTitle(Document document) {
        if (document == null) {
            return null;
        }
        Element ogTitle = document.selectFirst("meta[property=og:title]");
        String title = document.title();
        if ((title == null || title.isBlank()) && ogTitle != null) {
            title = ogTitle.attr("content");
        }
        return title;
    }

    private String cacheKey(String url) {
        return url == null ? "" : url.trim().toLowerCase(Locale.ROOT);
    }

    record LinkProfile(int internal, int external, int distinctExternalHosts) {
    }

    private record CachedClassification(ClassificationResult result, Instant expiresAt) {
    }
}
