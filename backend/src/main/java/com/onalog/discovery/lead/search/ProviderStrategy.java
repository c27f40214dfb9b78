package com.onalog.discovery.lead.search;

import com.onalog.discovery.lead.model.ProviderResult;

/**
 * A single search backend. Implementations never throw for remote failures; they report them through
 * {@link ProviderResult#failure}.
 */
public interface ProviderStrategy {
    String name();

    ProviderTier tier();

    ProviderResult attempt(SearchQuery query);
}
