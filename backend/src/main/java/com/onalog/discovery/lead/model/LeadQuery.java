package com.onalog.discovery.lead.model;

public record LeadQuery(
    int limit,
    int offset,
    Integer minScore,
    String country,
    String industry
) {
}
