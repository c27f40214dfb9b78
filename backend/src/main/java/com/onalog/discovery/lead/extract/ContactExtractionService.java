package com.onalog.discovery.lead.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.classify.DirectoryClassifier;
import com.onalog.discovery.lead.classify.SocialMediaSites;
import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.ClassificationResult;
import com.onalog.discovery.lead.model.DecisionMaker;
import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.model.PageExtraction;
import com.onalog.discovery.lead.sitemap.SitemapService;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches a company website and pulls out name, contact channels, address, social profiles and decision makers.
 * When the landing page lists fewer decision makers than wanted, likely team/about/contact pages are visited too.
 */
@Service
public class ContactExtractionService {
    private static final Logger log = LoggerFactory.getLogger(ContactExtractionService.class);
    static final List<String> PEOPLE_PATHS = List.of(
        "/about", "/team", "/leadership", "/management", "/board", "/company", "/about-us", "/our-team",
        "/who-we-are", "/equipo", "/nosotros", "/quienes-somos", "/contact", "/news", "/press", "/media"
    );
    private static final int MAX_EMAILS = 10;
    private static final int MAX_PHONES = 3;
    private static final String[] ADDRESS_SELECTORS = {
        "[itemprop=address]", "address", ".address", "#address", "[class*=address]"
    };

    private final PoliteHttpClient httpClient;
    private final DirectoryClassifier directoryClassifier;
    private final JsonLdReader jsonLdReader;
    private final DecisionMakerExtractor decisionMakerExtractor;
    private final SitemapService sitemapService;
    private final DiscoveryProperties properties;

    public ContactExtractionService(
        PoliteHttpClient httpClient,
        DirectoryClassifier directoryClassifier,
        JsonLdReader jsonLdReader,
        DecisionMakerExtractor decisionMakerExtractor,
        SitemapService sitemapService,
        DiscoveryProperties properties
    ) {
        this.httpClient = httpClient;
        this.directoryClassifier = directoryClassifier;
        this.jsonLdReader = jsonLdReader;
        this.decisionMakerExtractor = decisionMakerExtractor;
        this.sitemapService = sitemapService;
        this.properties = properties;
    }

    public PageExtraction extract(String url) {
        DiscoveryProperties.Pipeline pipeline = properties.getPipeline();
        Duration timeout = Duration.ofSeconds(pipeline.getPageTimeoutSeconds());
        HttpFetchResult fetch = httpClient.get(url, PoliteHttpClient.ACCEPT_HTML, timeout);
        if (!fetch.isSuccessful() || fetch.body() == null || !fetch.isHtml()) {
            log.debug("Extraction fetch failed for {}: {}", url, fetch.describeFailure());
            return PageExtraction.minimal(url, HostnameNormalizer.domainToken(url));
        }
        String pageUrl = fetch.finalUrlOrRequested();
        Document document = Jsoup.parse(fetch.body(), pageUrl);
        List<JsonNode> structuredData = jsonLdReader.read(document);

        ClassificationResult classification = directoryClassifier.classify(url, document);
        String companyName = CompanyNameResolver.fromPage(document, structuredData);
        LinkedHashSet<String> emails = new LinkedHashSet<>(EmailExtractor.extract(document));
        LinkedHashSet<String> phones = new LinkedHashSet<>(PhoneExtractor.extract(document));
        String address = extractAddress(document, structuredData);
        Map<String, String> socialLinks = extractSocialLinks(document);
        List<DecisionMaker> decisionMakers = decisionMakerExtractor.extract(document);

        if (decisionMakers.size() < pipeline.getDecisionMakerTarget()) {
            for (String auxiliaryUrl : auxiliaryPages(pageUrl, document, timeout, pipeline.getMaxAuxiliaryPages())) {
                HttpFetchResult auxiliary = httpClient.get(auxiliaryUrl, PoliteHttpClient.ACCEPT_HTML, timeout);
                if (!auxiliary.isSuccessful() || auxiliary.body() == null || !auxiliary.isHtml()) {
                    continue;
                }
                Document auxDocument = Jsoup.parse(auxiliary.body(), auxiliary.finalUrlOrRequested());
                decisionMakers = DecisionMakerExtractor.merge(
                    decisionMakers,
                    decisionMakerExtractor.extract(auxDocument),
                    pipeline.getMaxDecisionMakers()
                );
                addCapped(emails, EmailExtractor.extract(auxDocument), MAX_EMAILS);
                addCapped(phones, PhoneExtractor.extract(auxDocument), MAX_PHONES);
                if (address == null) {
                    address = extractAddress(auxDocument, jsonLdReader.read(auxDocument));
                }
                extractSocialLinks(auxDocument).forEach(socialLinks::putIfAbsent);
                if (decisionMakers.size() >= pipeline.getDecisionMakerTarget()) {
                    break;
                }
            }
        }

        return new PageExtraction(
            pageUrl,
            companyName,
            List.copyOf(emails),
            List.copyOf(phones),
            address,
            decisionMakers,
            Map.copyOf(socialLinks),
            classification,
            false
        );
    }

    List<String> auxiliaryPages(String pageUrl, Document document, Duration timeout, int max) {
        LinkedHashSet<String> pages = new LinkedHashSet<>();
        String host = HostnameNormalizer.normalize(pageUrl);
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (!href.isEmpty()
                && host.equals(HostnameNormalizer.normalize(href))
                && SitemapService.PEOPLE_PAGE.matcher(pathOf(href)).find()) {
                pages.add(stripFragment(href));
            }
        }
        String origin = originOf(pageUrl);
        if (origin != null) {
            for (String path : PEOPLE_PATHS) {
                pages.add(origin + path);
            }
        }
        if (pages.size() < max) {
            pages.addAll(sitemapService.findPeoplePages(pageUrl, max, timeout));
        }
        pages.remove(stripFragment(pageUrl));
        List<String> ordered = new ArrayList<>(pages);
        return ordered.size() > max ? ordered.subList(0, max) : ordered;
    }

    String extractAddress(Document document, List<JsonNode> structuredData) {
        for (JsonNode node : structuredData) {
            JsonNode address = node.get("address");
            if (address == null || address.isNull()) {
                continue;
            }
            if (address.isTextual() && !address.asText().isBlank()) {
                return address.asText().trim();
            }
            if (address.isObject()) {
                List<String> parts = new ArrayList<>();
                for (String field : List.of("streetAddress", "addressLocality", "addressRegion", "postalCode", "addressCountry")) {
                    String value = JsonLdReader.text(address, field);
                    if (value != null) {
                        parts.add(value);
                    }
                }
                if (!parts.isEmpty()) {
                    return String.join(", ", parts);
                }
            }
        }
        for (String selector : ADDRESS_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element != null) {
                String text = element.text().trim();
                if (text.length() >= 8 && text.length() <= 300) {
                    return text;
                }
            }
        }
        return null;
    }

    Map<String, String> extractSocialLinks(Document document) {
        Map<String, String> links = new LinkedHashMap<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                continue;
            }
            String platform = SocialMediaSites.platformOf(href);
            if (platform != null && !"unknown".equals(platform)) {
                links.putIfAbsent(platform, href);
            }
        }
        return links;
    }

    private static void addCapped(LinkedHashSet<String> target, List<String> additions, int max) {
        for (String value : additions) {
            if (target.size() >= max) {
                return;
            }
            target.add(value);
        }
    }

    private static String pathOf(String url) {
        try {
            String path = URI.create(url).getPath();
            return path == null ? "" : path.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String originOf(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            return uri.getScheme() + "://" + uri.getHost() + port;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        String value = hash >= 0 ? url.substring(0, hash) : url;
        return value.endsWith("/") && value.length() > 1 ? value.substring(0, value.length() - 1) : value;
    }
}
