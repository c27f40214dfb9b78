package com.onalog.discovery.lead.model;

import java.util.List;

public record ProviderResult(
    String provider,
    List<LeadCandidate> candidates,
    ProviderFailure failure,
    String message
) {
    public static ProviderResult success(String provider, List<LeadCandidate> candidates) {
        return new ProviderResult(provider, candidates == null ? List.of() : List.copyOf(candidates), null, null);
    }

    public static ProviderResult failure(String provider, ProviderFailure failure, String message) {
        return new ProviderResult(provider, List.of(), failure, message);
    }

    public boolean isFailure() {
        return failure != null;
    }

    public int count() {
        return candidates == null ? 0 : candidates.size();
    }
}
