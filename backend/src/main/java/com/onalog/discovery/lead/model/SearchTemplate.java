package com.onalog.discovery.lead.model;

import java.time.Instant;

public record SearchTemplate(
    long id,
    String tenantOwner,
    String name,
    String queryText,
    String countryFilter,
    String locationFilter,
    String industryHint,
    int resultTarget,
    Instant createdAt
) {
}
