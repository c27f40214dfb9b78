package com.onalog.discovery.lead.model;

public record NewSearchJob(
    String tenantOwner,
    String queryText,
    String countryFilter,
    String locationFilter,
    String industryHint,
    int resultTarget,
    int priority
) {
}
