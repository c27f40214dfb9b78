package com.onalog.discovery.lead.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExtractionStatus {
    PENDING,
    EXTRACTING,
    EXTRACTED,
    FAILED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExtractionStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return ExtractionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
