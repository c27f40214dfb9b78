package com.onalog.discovery.lead.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.classify.DirectoryClassifier;
import com.onalog.discovery.lead.classify.DirectorySites;
import com.onalog.discovery.lead.classify.SocialMediaSites;
import com.onalog.discovery.lead.collab.LinkExtractionClient;
import com.onalog.discovery.lead.extract.JsonLdReader;
import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.ClassificationResult;
import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Replaces directory and listicle results with the business websites they link to. The directory page itself
 * never reaches the pipeline.
 */
@Service
public class DirectoryExpander {
    private static final Logger log = LoggerFactory.getLogger(DirectoryExpander.class);
    static final String SOURCE = "directory";
    private static final Pattern LISTICLE_TITLE = Pattern.compile(
        "\\btop\\s+\\d+|\\b\\d+\\s+best\\b|\\blist of\\b|\\bdirectory\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final int MIN_ANCHOR_TEXT = 2;

    private final PoliteHttpClient httpClient;
    private final DirectoryClassifier directoryClassifier;
    private final JsonLdReader jsonLdReader;
    private final LinkExtractionClient linkExtractionClient;
    private final DiscoveryProperties properties;

    public DirectoryExpander(
        PoliteHttpClient httpClient,
        DirectoryClassifier directoryClassifier,
        JsonLdReader jsonLdReader,
        LinkExtractionClient linkExtractionClient,
        DiscoveryProperties properties
    ) {
        this.httpClient = httpClient;
        this.directoryClassifier = directoryClassifier;
        this.jsonLdReader = jsonLdReader;
        this.linkExtractionClient = linkExtractionClient;
        this.properties = properties;
    }

    public record Expansion(List<LeadCandidate> candidates, int directoriesExpanded) {
    }

    public Expansion expand(List<LeadCandidate> candidates, int resultTarget) {
        List<LeadCandidate> kept = new ArrayList<>();
        int expanded = 0;
        for (LeadCandidate candidate : candidates) {
            if (!isDirectory(candidate)) {
                kept.add(candidate);
                continue;
            }
            expanded++;
            List<LeadCandidate> links = expandDirectory(candidate.link(), resultTarget);
            log.info("Expanded directory {} into {} candidate links", candidate.link(), links.size());
            kept.addAll(links);
        }
        return new Expansion(SearchResultMerger.dedupe(kept), expanded);
    }

    static int capFor(int resultTarget, int floor, int ceiling) {
        return Math.max(floor, Math.min(ceiling, resultTarget / 2));
    }

    boolean isDirectory(LeadCandidate candidate) {
        String link = candidate.link();
        if (HostnameNormalizer.isPlaceholderLink(link)) {
            return false;
        }
        if (DirectorySites.isDirectorySite(link)) {
            return true;
        }
        if (candidate.title() != null && LISTICLE_TITLE.matcher(candidate.title()).find()) {
            ClassificationResult classification = directoryClassifier.classify(link);
            return directoryClassifier.isRejected(classification);
        }
        return false;
    }

    List<LeadCandidate> expandDirectory(String directoryUrl, int resultTarget) {
        DiscoveryProperties.Search search = properties.getSearch();
        int cap = capFor(resultTarget, search.getDirectoryCapFloor(), search.getDirectoryCapCeiling());
        HttpFetchResult fetch = httpClient.get(
            directoryUrl,
            PoliteHttpClient.ACCEPT_HTML,
            Duration.ofSeconds(properties.getPipeline().getPageTimeoutSeconds())
        );
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("Directory {} could not be fetched: {}", directoryUrl, fetch.describeFailure());
            return List.of();
        }
        String pageUrl = fetch.finalUrlOrRequested();
        Document document = Jsoup.parse(fetch.body(), pageUrl);
        String directoryHost = HostnameNormalizer.normalize(pageUrl);
        Map<String, LeadCandidate> byHost = new LinkedHashMap<>();

        for (JsonNode node : jsonLdReader.read(document)) {
            collectStructured(node, directoryHost, byHost, cap);
        }
        for (Element anchor : document.select("a[href]")) {
            if (byHost.size() >= cap) {
                break;
            }
            String text = anchor.text().trim();
            if (text.length() < MIN_ANCHOR_TEXT || LISTICLE_TITLE.matcher(text).find()) {
                continue;
            }
            offer(anchor.absUrl("href"), text, directoryHost, byHost, cap);
        }

        int minimumParsed = Math.min(5, cap / 4);
        if (byHost.size() < minimumParsed) {
            for (LeadCandidate suggested : modelLinks(fetch.body(), pageUrl, cap)) {
                offer(suggested.link(), suggested.title(), directoryHost, byHost, cap);
            }
        }
        return new ArrayList<>(byHost.values());
    }

    private void collectStructured(JsonNode node, String directoryHost, Map<String, LeadCandidate> byHost, int cap) {
        if (JsonLdReader.isBusinessEntity(node)) {
            offer(JsonLdReader.text(node, "url"), JsonLdReader.text(node, "name"), directoryHost, byHost, cap);
        }
        for (JsonNode element : node.path("itemListElement")) {
            JsonNode item = element.has("item") ? element.get("item") : element;
            if (item.isTextual()) {
                offer(item.asText(), JsonLdReader.text(element, "name"), directoryHost, byHost, cap);
            } else {
                String name = JsonLdReader.text(item, "name");
                offer(JsonLdReader.text(item, "url"), name != null ? name : JsonLdReader.text(element, "name"),
                    directoryHost, byHost, cap);
            }
        }
    }

    private void offer(String url, String title, String directoryHost, Map<String, LeadCandidate> byHost, int cap) {
        if (url == null || byHost.size() >= cap) {
            return;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return;
        }
        String host = HostnameNormalizer.normalize(url);
        if (host.isEmpty() || host.equals(directoryHost) || byHost.containsKey(host)) {
            return;
        }
        if (SocialMediaSites.isSocialMediaUrl(url) || DirectorySites.isDirectorySite(url)) {
            return;
        }
        String name = title == null || title.isBlank() ? HostnameNormalizer.domainToken(url) : title.trim();
        byHost.put(host, LeadCandidate.of(name, url, "", SOURCE));
    }

    private List<LeadCandidate> modelLinks(String html, String pageUrl, int cap) {
        try {
            List<LeadCandidate> links = linkExtractionClient.extractCompanyLinks(html, pageUrl, cap);
            return links == null ? List.of() : links;
        } catch (RuntimeException e) {
            log.warn("Link extraction failed for directory {}", pageUrl, e);
            return List.of();
        }
    }
}
