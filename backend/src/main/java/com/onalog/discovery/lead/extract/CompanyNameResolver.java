package com.onalog.discovery.lead.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks the display name of a lead: the page's own name wins, then the search result title, then the domain.
 */
public final class CompanyNameResolver {
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[-|–—:]\\s+|\\s*\\|\\s*");
    private static final Pattern NUMERIC_ONLY = Pattern.compile("^[\\d\\s\\-_.]+$");
    private static final Pattern PLACE_ID = Pattern.compile("^ChIJ[\\w-]+$");
    private static final Pattern DOMAIN_LIKE = Pattern.compile("^[\\w-]+(\\.[\\w-]+)+$");
    private static final Set<String> GENERIC_NAMES = Set.of(
        "home", "homepage", "home page", "welcome", "index", "contact", "contact us", "about", "about us",
        "untitled", "default", "page not found", "404", "not found", "access denied", "just a moment..."
    );
    private static final Set<String> UNKNOWN_NAMES = Set.of("unknown", "n/a", "null", "undefined", "none");

    private CompanyNameResolver() {
    }

    /**
     * Reads the name a page gives itself: {@code og:site_name}, {@code og:title}, JSON-LD business name, then the
     * first segment of the title.
     */
    public static String fromPage(Document document, List<JsonNode> structuredData) {
        if (document == null) {
            return null;
        }
        String siteName = meta(document, "og:site_name");
        if (usable(siteName)) {
            return siteName;
        }
        String ogTitle = firstSegment(meta(document, "og:title"));
        if (usable(ogTitle)) {
            return ogTitle;
        }
        if (structuredData != null) {
            for (JsonNode node : structuredData) {
                if (JsonLdReader.isBusinessEntity(node)) {
                    String name = JsonLdReader.text(node, "name");
                    if (usable(name)) {
                        return name;
                    }
                }
            }
        }
        String title = firstSegment(document.title());
        return usable(title) ? title : null;
    }

    public static String resolve(String pageName, String searchTitle, String url) {
        if (usable(pageName) && !isDomainLike(pageName)) {
            return pageName.trim();
        }
        String titleName = firstSegment(searchTitle);
        if (usable(titleName) && !isDomainLike(titleName)) {
            return titleName;
        }
        if (usable(pageName)) {
            return pageName.trim();
        }
        String token = HostnameNormalizer.domainToken(url);
        return token.isEmpty() ? null : token;
    }

    public static boolean isRejected(String name) {
        if (name == null) {
            return true;
        }
        String trimmed = name.trim();
        if (trimmed.length() < 2 || trimmed.length() > 200) {
            return true;
        }
        if (NUMERIC_ONLY.matcher(trimmed).matches()) {
            return true;
        }
        if (UNKNOWN_NAMES.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return trimmed.length() > 20 && PLACE_ID.matcher(trimmed).matches();
    }

    public static boolean isGeneric(String name) {
        return name == null || name.isBlank() || GENERIC_NAMES.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    static boolean isDomainLike(String name) {
        return name != null && DOMAIN_LIKE.matcher(name.trim()).matches();
    }

    static String firstSegment(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String first = TITLE_SEPARATOR.split(title.trim(), 2)[0].trim();
        return first.isEmpty() ? null : first;
    }

    private static boolean usable(String name) {
        return !isGeneric(name) && !isRejected(name);
    }

    private static String meta(Document document, String property) {
        Element element = document.selectFirst("meta[property=" + property + "]");
        if (element == null) {
            return null;
        }
        String content = element.attr("content").trim();
        return content.isEmpty() ? null : content;
    }
}
