package com.onalog.discovery.lead.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnrichmentStatus {
    PENDING,
    ENRICHING,
    ENRICHED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EnrichmentStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return EnrichmentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
