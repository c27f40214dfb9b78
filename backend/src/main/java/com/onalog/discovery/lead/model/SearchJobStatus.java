package com.onalog.discovery.lead.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SearchJobStatus {
    PENDING,
    QUEUED,
    SEARCHING,
    EXTRACTING,
    ENRICHING,
    PROCESSING_BACKFILL,
    COMPLETED,
    FAILED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Statuses only move forward through the pipeline order. {@link #FAILED} is reachable from any
     * non-terminal stage; re-asserting the current status is allowed so progress writes stay idempotent.
     */
    public boolean canTransitionTo(SearchJobStatus next) {
        if (next == null) {
            return false;
        }
        if (this == FAILED) {
            return false;
        }
        if (next == FAILED) {
            return this != COMPLETED;
        }
        return next.ordinal() >= ordinal();
    }

    public static SearchJobStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return SearchJobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
