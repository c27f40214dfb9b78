package com.onalog.discovery.lead.model;

public enum ProviderFailure {
    TIMEOUT,
    RATE_LIMITED,
    AUTH_MISSING,
    DISABLED,
    ERROR
}
