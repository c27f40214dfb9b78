package com.onalog.discovery.lead.collab;

import com.onalog.discovery.lead.model.Lead;

/**
 * AI enrichment of a persisted lead. Implementations must fail open: return {@link EnrichmentResult#empty()}
 * rather than throwing when the upstream model is unavailable.
 */
public interface EnrichmentClient {
    EnrichmentResult enrich(Lead lead);
}
