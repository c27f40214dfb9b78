package com.onalog.discovery.lead.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class EmailExtractor {
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern OBFUSCATED_EMAIL = Pattern.compile(
        "([A-Za-z0-9._%+-]+)\\s*[\\[(]\\s*at\\s*[\\])]\\s*([A-Za-z0-9-]+(?:\\s*[\\[(]\\s*dot\\s*[\\])]\\s*[A-Za-z0-9-]+)+)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern DOT_TOKEN = Pattern.compile("\\s*[\\[(]\\s*dot\\s*[\\])]\\s*", Pattern.CASE_INSENSITIVE);
    private static final List<String> REJECTED_FRAGMENTS = List.of(
        "noreply", "no-reply", "donotreply", "example.com", "placeholder", "your-email", "youremail",
        "email@domain", "sentry.io", "wixpress.com"
    );
    private static final List<String> REJECTED_PREFIXES = List.of("test@", "user@", "name@");
    private static final List<String> FILE_SUFFIXES = List.of(".png", ".jpg", ".jpeg", ".gif", ".svg", ".webp");
    private static final int MAX_EMAILS = 10;

    private EmailExtractor() {
    }

    public static List<String> extract(Document document) {
        Set<String> found = new LinkedHashSet<>();
        if (document == null) {
            return List.of();
        }
        for (Element anchor : document.select("a[href^=mailto:], a[href^=MAILTO:]")) {
            String href = anchor.attr("href").substring("mailto:".length());
            int query = href.indexOf('?');
            if (query >= 0) {
                href = href.substring(0, query);
            }
            for (String part : href.split(",")) {
                addIfValid(found, part);
            }
        }
        collectFromText(document.text(), found);
        return limit(found);
    }

    public static List<String> extractFromText(String text) {
        Set<String> found = new LinkedHashSet<>();
        collectFromText(text, found);
        return limit(found);
    }

    public static boolean isBusinessEmail(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String lower = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(lower).matches()) {
            return false;
        }
        for (String fragment : REJECTED_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return false;
            }
        }
        for (String prefix : REJECTED_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return false;
            }
        }
        for (String suffix : FILE_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return false;
            }
        }
        return true;
    }

    private static void collectFromText(String text, Set<String> found) {
        if (text == null || text.isBlank()) {
            return;
        }
        Matcher matcher = EMAIL.matcher(text);
        while (matcher.find()) {
            addIfValid(found, matcher.group());
        }
        Matcher obfuscated = OBFUSCATED_EMAIL.matcher(text);
        while (obfuscated.find()) {
            String domain = DOT_TOKEN.matcher(obfuscated.group(2)).replaceAll(".");
            addIfValid(found, obfuscated.group(1) + "@" + domain);
        }
    }

    private static void addIfValid(Set<String> found, String candidate) {
        if (candidate == null) {
            return;
        }
        String email = candidate.trim().toLowerCase(Locale.ROOT);
        while (email.endsWith(".")) {
            email = email.substring(0, email.length() - 1);
        }
        if (isBusinessEmail(email)) {
            found.add(email);
        }
    }

    private static List<String> limit(Set<String> found) {
        List<String> result = new ArrayList<>(found);
        return result.size() > MAX_EMAILS ? List.copyOf(result.subList(0, MAX_EMAILS)) : List.copyOf(result);
    }
}
