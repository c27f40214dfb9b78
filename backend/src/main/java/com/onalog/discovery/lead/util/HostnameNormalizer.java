package com.onalog.discovery.lead.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical hostname form used for every website comparison: lower-cased, no scheme, no {@code www.},
 * no path, query, fragment, port or trailing dot.
 */
public final class HostnameNormalizer {
    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://", Pattern.CASE_INSENSITIVE);

    private HostnameNormalizer() {
    }

    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.trim();
        if (!SCHEME.matcher(value).find()) {
            value = "https://" + value;
        }
        try {
            String host = new URI(value).getHost();
            if (host != null && !host.isBlank()) {
                return stripDecorations(host.toLowerCase(Locale.ROOT));
            }
        } catch (URISyntaxException ignored) {
            // fall through to textual stripping
        }
        return textualHost(url);
    }

    /**
     * Links that stand in for a business without a website (search result pages, place references).
     * They are never compared by hostname.
     */
    public static boolean isPlaceholderLink(String url) {
        if (url == null || url.isBlank()) {
            return true;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("places:")
            || lower.contains("google.com/search")
            || lower.contains("google.com/maps")
            || lower.contains("openstreetmap.org/node")
            || lower.contains("openstreetmap.org/way");
    }

    /**
     * First DNS label of the host, capitalized: {@code https://www.acme-labs.io/x} becomes {@code Acme-labs}.
     */
    public static String domainToken(String url) {
        String host = normalize(url);
        if (host.isEmpty()) {
            return "";
        }
        int dot = host.indexOf('.');
        String token = dot > 0 ? host.substring(0, dot) : host;
        if (token.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(token.charAt(0)) + token.substring(1);
    }

    public static boolean isSameHost(String left, String right) {
        String a = normalize(left);
        return !a.isEmpty() && a.equals(normalize(right));
    }

    private static String textualHost(String url) {
        String value = SCHEME.matcher(url.trim()).replaceFirst("");
        int cut = value.length();
        for (char stop : new char[] {'/', '?', '#'}) {
            int index = value.indexOf(stop);
            if (index >= 0 && index < cut) {
                cut = index;
            }
        }
        return stripDecorations(value.substring(0, cut).toLowerCase(Locale.ROOT));
    }

    private static String stripDecorations(String host) {
        String value = host;
        if (value.startsWith("www.")) {
            value = value.substring(4);
        }
        int colon = value.indexOf(':');
        if (colon >= 0) {
            value = value.substring(0, colon);
        }
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
