package com.onalog.discovery.lead.model;

public record SearchRequest(
    String query,
    String country,
    String location,
    String industry,
    Integer resultCount
) {
}
