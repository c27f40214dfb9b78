package com.onalog.discovery.lead.classify;

import com.onalog.discovery.lead.util.HostnameNormalizer;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static knowledge about aggregator and listing sites: domains that never host a first-party business page and
 * path shapes that indicate lists of businesses.
 */
public final class DirectorySites {
    private static final List<String> AGGREGATOR_DOMAINS = List.of(
        // data aggregators
        "tomba.io", "cybo.com", "cience.com", "wrkr.com", "zoominfo.com", "opencorporates.com",
        "poidata.io", "dnb.com", "f6s.com", "ensun.io", "aeroleads.com", "tracxn.com", "crunchbase.com",
        // business directories
        "yelp.com", "yellowpages.com", "whitepages.com", "business.com", "manta.com", "bbb.org",
        "indeed.com", "glassdoor.com", "businesslist.com.ng", "finelib.com", "worldorgs.com",
        "infoaboutcompanies.com", "africabizinfo.com", "starofservice.com",
        // listing, review and travel aggregators
        "goodfirms.co", "clutch.co", "kyero.com", "properstar.com", "realting.com", "jamesedition.com",
        "tripadvisor.com", "zomato.com", "foursquare.com", "opentable.com", "restaurantguru.com",
        "google.com/maps",
        // reference sites
        "wikipedia.org", "wikidata.org", "openstreetmap.org"
    );
    private static final Pattern AGGREGATOR_PATH = Pattern.compile(
        "/(category|tags|companies|agencies|estate-agents|real-estate-agents|company-directory|partners)\\b"
    );
    private static final List<String> AGGREGATOR_PATH_FRAGMENTS = List.of(
        "/top-", "/best", "/list", "/explore/", "sharearticle"
    );
    private static final Pattern ARTICLE_PATH = Pattern.compile(
        "/(blog|blogs|news|article|articles|post|posts|magazine|stories)(/|$)|/\\d{4}/\\d{2}/"
    );

    private DirectorySites() {
    }

    public static boolean isDirectorySite(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        if (isAggregatorDomain(url)) {
            return true;
        }
        return isAggregatorPath(pathOf(url));
    }

    public static boolean isAggregatorDomain(String url) {
        String host = HostnameNormalizer.normalize(url);
        if (host.isEmpty()) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String domain : AGGREGATOR_DOMAINS) {
            if (domain.contains("/")) {
                if (lower.contains(domain)) {
                    return true;
                }
            } else if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isAggregatorPath(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        if (AGGREGATOR_PATH.matcher(lower).find()) {
            return true;
        }
        for (String fragment : AGGREGATOR_PATH_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Blog posts, news items and dated articles describe businesses rather than being one.
     */
    public static boolean isArticlePage(String url) {
        return ARTICLE_PATH.matcher(pathOf(url)).find();
    }

    static String pathOf(String url) {
        if (url == null) {
            return "";
        }
        try {
            String value = url.trim();
            if (!value.contains("://")) {
                value = "https://" + value;
            }
            String path = URI.create(value).getPath();
            return path == null ? "" : path.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
