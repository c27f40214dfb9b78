package com.onalog.discovery.lead.collab;

import com.onalog.discovery.lead.model.DecisionMaker;

import java.util.List;

public record EnrichmentResult(
    String industry,
    String companySize,
    Integer signalStrength,
    Integer verificationScore,
    String emailPattern,
    List<DecisionMaker> decisionMakers
) {
    public static EnrichmentResult empty() {
        return new EnrichmentResult(null, null, null, null, null, List.of());
    }
}
