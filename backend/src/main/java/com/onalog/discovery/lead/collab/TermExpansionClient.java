package com.onalog.discovery.lead.collab;

import java.util.List;

public interface TermExpansionClient {
    /**
     * Alternative phrasings of {@code query} in the given locale (ISO 639-1), most useful first.
     */
    List<String> expand(String query, String locale);
}
