package com.onalog.discovery.lead.model;

public record LeadCandidate(
    String title,
    String link,
    String snippet,
    String phone,
    String address,
    String providerPlaceId,
    String source
) {
    public static LeadCandidate of(String title, String link, String snippet, String source) {
        return new LeadCandidate(title, link, snippet, null, null, null, source);
    }

    public LeadCandidate withSource(String newSource) {
        return new LeadCandidate(title, link, snippet, phone, address, providerPlaceId, newSource);
    }
}
