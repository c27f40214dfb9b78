package com.onalog.discovery.lead.search;

import com.onalog.discovery.lead.classify.SocialMediaSites;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.ProviderResult;
import com.onalog.discovery.lead.util.HostnameNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges provider output in tier order, keeping the first occurrence of each business.
 */
public final class SearchResultMerger {
    private SearchResultMerger() {
    }

    public static List<LeadCandidate> merge(Map<ProviderTier, List<ProviderResult>> resultsByTier) {
        List<LeadCandidate> ordered = new ArrayList<>();
        for (ProviderTier tier : ProviderTier.values()) {
            for (ProviderResult result : resultsByTier.getOrDefault(tier, List.of())) {
                if (!result.isFailure()) {
                    ordered.addAll(result.candidates());
                }
            }
        }
        return dedupe(ordered);
    }

    public static List<LeadCandidate> dedupe(Collection<LeadCandidate> candidates) {
        Set<String> seen = new HashSet<>();
        List<LeadCandidate> unique = new ArrayList<>();
        for (LeadCandidate candidate : candidates) {
            if (candidate == null || !isUsable(candidate)) {
                continue;
            }
            String key = identityKey(candidate);
            if (key == null || !seen.add(key)) {
                continue;
            }
            if (candidate.providerPlaceId() != null && !seen.add("place:" + candidate.providerPlaceId())) {
                continue;
            }
            unique.add(candidate);
        }
        return unique;
    }

    /**
     * Hostname for real websites; name plus snippet for placeholder links, which carry no comparable host.
     */
    public static String identityKey(LeadCandidate candidate) {
        if (HostnameNormalizer.isPlaceholderLink(candidate.link())) {
            String title = candidate.title() == null ? "" : candidate.title().trim().toLowerCase(Locale.ROOT);
            if (title.isEmpty()) {
                return null;
            }
            String snippet = candidate.snippet() == null ? "" : candidate.snippet().trim().toLowerCase(Locale.ROOT);
            return "name:" + title + "|" + snippet;
        }
        String host = HostnameNormalizer.normalize(candidate.link());
        return host.isEmpty() ? null : "host:" + host;
    }

    private static boolean isUsable(LeadCandidate candidate) {
        String link = candidate.link();
        if (link == null || link.isBlank()) {
            return false;
        }
        if (HostnameNormalizer.isPlaceholderLink(link)) {
            return true;
        }
        String lower = link.toLowerCase(Locale.ROOT);
        return (lower.startsWith("http://") || lower.startsWith("https://")) && !SocialMediaSites.isSocialMediaUrl(link);
    }
}
