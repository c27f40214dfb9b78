package com.onalog.discovery.lead.sitemap;

import com.onalog.discovery.lead.http.PoliteHttpClient;
import com.onalog.discovery.lead.model.HttpFetchResult;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Walks a site's {@code /sitemap.xml} (one level of sitemap indexes) looking for team, about and contact pages.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final String ACCEPT_XML = "application/xml,text/xml;q=0.9,*/*;q=0.1";
    private static final int MAX_SITEMAPS = 4;
    private static final int MAX_DEPTH = 1;
    public static final Pattern PEOPLE_PAGE = Pattern.compile(
        "/(team|our-team|the-team|people|leadership|management|about|about-us|who-we-are|staff|board|"
            + "executives|founders|contact|contact-us|equipe|equipo|nosotros|quienes-somos|sobre|chi-siamo)(/|$|\\.html?$)"
    );

    private final PoliteHttpClient httpClient;

    public SitemapService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public List<String> findPeoplePages(String siteUrl, int maxUrls, Duration timeout) {
        String root = siteRoot(siteUrl);
        if (root == null || maxUrls <= 0) {
            return List.of();
        }
        String host = HostnameNormalizer.normalize(root);
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        queue.add(new SitemapTask(root + "/sitemap.xml", 0));
        LinkedHashSet<String> visited = new LinkedHashSet<>();
        LinkedHashSet<String> pages = new LinkedHashSet<>();

        while (!queue.isEmpty() && visited.size() < MAX_SITEMAPS && pages.size() < maxUrls) {
            SitemapTask current = queue.removeFirst();
            if (!visited.add(current.url())) {
                continue;
            }
            HttpFetchResult fetch = httpClient.getOnce(current.url(), ACCEPT_XML, timeout);
            if (!fetch.isSuccessful() || fetch.body() == null || fetch.body().isBlank()) {
                log.debug("Sitemap unavailable at {}: {}", current.url(), fetch.describeFailure());
                continue;
            }
            Document xml = Jsoup.parse(fetch.body(), "", Parser.xmlParser());
            if (current.depth() < MAX_DEPTH) {
                for (Element loc : xml.select("sitemap > loc")) {
                    String child = loc.text().trim();
                    if (!child.isEmpty() && HostnameNormalizer.isSameHost(child, root)) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                    }
                }
            }
            for (Element loc : xml.select("url > loc")) {
                String page = loc.text().trim();
                if (page.isEmpty() || !host.equals(HostnameNormalizer.normalize(page))) {
                    continue;
                }
                if (isPeoplePage(page)) {
                    pages.add(page);
                    if (pages.size() >= maxUrls) {
                        break;
                    }
                }
            }
        }
        return new ArrayList<>(pages);
    }

    static boolean isPeoplePage(String url) {
        try {
            String path = URI.create(url).getPath();
            return path != null && PEOPLE_PAGE.matcher(path.toLowerCase(Locale.ROOT)).find();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static String siteRoot(String siteUrl) {
        if (siteUrl == null || siteUrl.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(siteUrl.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost() + port;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private record SitemapTask(String url, int depth) {
    }
}
