package com.onalog.discovery.lead.model;

import java.util.List;
import java.util.Map;

public record PageExtraction(
    String url,
    String companyName,
    List<String> emails,
    List<String> phones,
    String address,
    List<DecisionMaker> decisionMakers,
    Map<String, String> socialLinks,
    ClassificationResult classification,
    boolean fetchFailed
) {
    public static PageExtraction minimal(String url, String fallbackName) {
        return new PageExtraction(
            url,
            fallbackName,
            List.of(),
            List.of(),
            null,
            List.of(),
            Map.of(),
            ClassificationResult.fallback(),
            true
        );
    }
}
