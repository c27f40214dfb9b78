package com.onalog.discovery.lead.pipeline;

import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class PipelineFixtures {
    private PipelineFixtures() {
    }

    static SearchJob job(long id, int resultTarget) {
        Instant now = Instant.now();
        return new SearchJob(
            id,
            "tenant-a",
            "cafes",
            "ke",
            "Nairobi",
            null,
            resultTarget,
            0,
            SearchJobStatus.SEARCHING,
            0,
            0,
            0,
            Map.of(),
            null,
            null,
            now,
            now,
            null,
            now
        );
    }

    static List<LeadCandidate> candidates(int count) {
        List<LeadCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candidates.add(LeadCandidate.of("Cafe " + i, "https://cafe-" + i + ".co.ke/", "", "overpass"));
        }
        return candidates;
    }
}
