package com.onalog.discovery.lead.model;

import java.util.List;

public record SearchResultsResponse(
    SearchJob job,
    List<Lead> leads,
    int page,
    int size,
    long totalLeads,
    boolean previewLimited
) {
}
