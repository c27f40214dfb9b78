package com.onalog.discovery.lead.model;

public enum ExtractionOutcome {
    SAVED,
    DUPLICATE,
    REJECTED,
    CAP_REACHED,
    JOB_MISSING,
    FAILED
}
