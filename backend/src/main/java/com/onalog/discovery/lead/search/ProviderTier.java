package com.onalog.discovery.lead.search;

/**
 * Provider families in merge order: earlier tiers win when two providers return the same business.
 */
public enum ProviderTier {
    GEOGRAPHIC,
    METASEARCH,
    WEB,
    PAID,
    SCRAPE
}
