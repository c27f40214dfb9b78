package com.onalog.discovery.lead.model;

import java.time.Instant;
import java.util.Map;

public record SearchJob(
    long id,
    String tenantOwner,
    String queryText,
    String countryFilter,
    String locationFilter,
    String industryHint,
    int resultTarget,
    int priority,
    SearchJobStatus status,
    int totalResults,
    int extractedCount,
    int enrichedCount,
    Map<String, Object> providerTelemetry,
    String shortfallReason,
    String errorMessage,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt
) {
}
