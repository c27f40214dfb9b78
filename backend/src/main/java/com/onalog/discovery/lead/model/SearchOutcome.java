package com.onalog.discovery.lead.model;

import java.util.List;
import java.util.Map;

public record SearchOutcome(
    List<LeadCandidate> results,
    Map<String, Object> telemetry,
    String shortfallReason
) {
}
