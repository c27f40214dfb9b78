package com.onalog.discovery.lead.classify;

import com.onalog.discovery.lead.util.HostnameNormalizer;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public final class SocialMediaSites {
    private static final Map<String, String> PLATFORMS = Map.ofEntries(
        Map.entry("facebook.com", "facebook"),
        Map.entry("fb.com", "facebook"),
        Map.entry("instagram.com", "instagram"),
        Map.entry("twitter.com", "twitter"),
        Map.entry("x.com", "twitter"),
        Map.entry("linkedin.com", "linkedin"),
        Map.entry("youtube.com", "youtube"),
        Map.entry("tiktok.com", "tiktok"),
        Map.entry("pinterest.com", "pinterest"),
        Map.entry("snapchat.com", "snapchat"),
        Map.entry("reddit.com", "reddit"),
        Map.entry("tumblr.com", "tumblr"),
        Map.entry("vimeo.com", "vimeo"),
        Map.entry("medium.com", "medium"),
        Map.entry("github.com", "github"),
        Map.entry("whatsapp.com", "whatsapp"),
        Map.entry("wa.me", "whatsapp"),
        Map.entry("t.me", "telegram"),
        Map.entry("linktr.ee", "linktree")
    );
    private static final Pattern SOCIAL_TEXT = Pattern.compile(
        "(facebook|instagram|twitter|linkedin|youtube|tiktok|pinterest|snapchat|reddit|tumblr|vimeo|whatsapp)\\.(com|me)"
    );

    private SocialMediaSites() {
    }

    public static boolean isSocialMediaUrl(String url) {
        return platformOf(url) != null;
    }

    public static String platformOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String host = HostnameNormalizer.normalize(url);
        for (Map.Entry<String, String> entry : PLATFORMS.entrySet()) {
            String domain = entry.getKey();
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return entry.getValue();
            }
        }
        if (host.isEmpty() && SOCIAL_TEXT.matcher(url.toLowerCase(Locale.ROOT)).find()) {
            return "unknown";
        }
        return null;
    }
}
