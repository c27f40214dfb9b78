package com.onalog.discovery.lead.collab;

import com.onalog.discovery.lead.model.LeadCandidate;

import java.util.List;

public interface LinkExtractionClient {
    /**
     * Model-assisted extraction of business links from a directory page whose anchors did not parse well.
     */
    List<LeadCandidate> extractCompanyLinks(String html, String pageUrl, int max);
}
