package com.onalog.discovery.lead.collab;

import com.onalog.discovery.lead.model.LeadCandidate;

public interface RelevanceClient {
    RelevanceVerdict isRelevant(LeadCandidate candidate, String query, String industry);
}
