package com.onalog.discovery.lead.search.provider;

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
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort HTML scrape of DuckDuckGo's lite endpoint. Throttled responses (202/403/429) are retried after
 * the configured backoff; anything else fails immediately.
 */
@Component
public class DuckDuckGoProvider implements ProviderStrategy {
    public static final String NAME = "duckduckgo";
    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoProvider.class);
    private static final Pattern UDDG = Pattern.compile("[?&]uddg=([^&]+)");

    private final PoliteHttpClient httpClient;
    private final DiscoveryProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public DuckDuckGoProvider(PoliteHttpClient httpClient, DiscoveryProperties properties) {
        this(httpClient, properties, Sleeper.SYSTEM);
    }

    DuckDuckGoProvider(PoliteHttpClient httpClient, DiscoveryProperties properties, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderTier tier() {
        return ProviderTier.SCRAPE;
    }

    @Override
    public ProviderResult attempt(SearchQuery query) {
        String url = properties.getProviders().getDuckDuckGoUrl()
            + "?q=" + ProviderResponses.encode(query.withGeography(query.query()) + " business company");
        Duration timeout = Duration.ofSeconds(properties.getSearch().getProviderTimeoutSeconds());
        List<Integer> backoffs = properties.getSearch().getScrapeBackoffSeconds();
        int attempts = Math.max(1, backoffs.size());
        HttpFetchResult fetch = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            fetch = httpClient.getOnce(url, PoliteHttpClient.ACCEPT_HTML, timeout);
            if (fetch.isSuccessful() && fetch.statusCode() != 202) {
                return ProviderResult.success(NAME, parse(fetch.body(), query.resultTarget()));
            }
            if (!fetch.isRateLimited()) {
                return ProviderResponses.failureOf(NAME, fetch);
            }
            if (attempt + 1 < attempts) {
                Duration backoff = Duration.ofSeconds(backoffs.get(attempt));
                log.info("DuckDuckGo throttled (http {}), retrying in {}s", fetch.statusCode(), backoff.toSeconds());
                if (!sleeper.sleep(backoff)) {
                    break;
                }
            }
        }
        String detail = fetch == null ? "no attempt made" : "throttled after retries: " + fetch.describeFailure();
        return ProviderResult.failure(NAME, ProviderFailure.RATE_LIMITED, detail);
    }

    static List<LeadCandidate> parse(String html, int max) {
        List<LeadCandidate> candidates = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return candidates;
        }
        Document document = Jsoup.parse(html);
        Set<String> seen = new LinkedHashSet<>();
        for (Element result : document.select(".result, .web-result")) {
            Element anchor = result.selectFirst("a.result__a, h2 a");
            if (anchor == null) {
                continue;
            }
            String link = resolveRedirect(anchor.attr("href"));
            String title = anchor.text().trim();
            if (title.isEmpty() || link == null || !link.startsWith("http") || link.contains("duckduckgo.com")) {
                continue;
            }
            if (DirectorySites.isDirectorySite(link) || !seen.add(link)) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            candidates.add(LeadCandidate.of(title, link, snippet == null ? "" : snippet.text().trim(), NAME));
            if (candidates.size() >= max) {
                break;
            }
        }
        return candidates;
    }

    static String resolveRedirect(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        Matcher matcher = UDDG.matcher(href);
        if (matcher.find()) {
            return URLDecoder.decode(matcher.group(1), StandardCharsets.UTF_8);
        }
        return href.startsWith("//") ? "https:" + href : href;
    }
}
