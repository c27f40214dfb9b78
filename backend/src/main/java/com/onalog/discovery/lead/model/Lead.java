package com.onalog.discovery.lead.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record Lead(
    Long id,
    long searchJobId,
    String companyName,
    String website,
    List<String> emails,
    List<String> phoneNumbers,
    String address,
    String country,
    String industry,
    List<DecisionMaker> decisionMakers,
    Map<String, String> socialLinks,
    boolean duplicate,
    Long duplicateOfLeadId,
    ExtractionStatus extractionStatus,
    EnrichmentStatus enrichmentStatus,
    Integer qualityScore,
    Integer verificationScore,
    Integer signalStrength,
    String source,
    Instant createdAt
) {
    public Lead withDuplicate(DuplicateCheckResult check) {
        return new Lead(
            id,
            searchJobId,
            companyName,
            website,
            emails,
            phoneNumbers,
            address,
            country,
            industry,
            decisionMakers,
            socialLinks,
            check.duplicate(),
            check.duplicateOfLeadId(),
            extractionStatus,
            enrichmentStatus,
            qualityScore,
            verificationScore,
            signalStrength,
            source,
            createdAt
        );
    }

    public Lead withId(long newId) {
        return new Lead(
            newId,
            searchJobId,
            companyName,
            website,
            emails,
            phoneNumbers,
            address,
            country,
            industry,
            decisionMakers,
            socialLinks,
            duplicate,
            duplicateOfLeadId,
            extractionStatus,
            enrichmentStatus,
            qualityScore,
            verificationScore,
            signalStrength,
            source,
            createdAt
        );
    }

    public Lead withQualityScore(int score) {
        return new Lead(
            id,
            searchJobId,
            companyName,
            website,
            emails,
            phoneNumbers,
            address,
            country,
            industry,
            decisionMakers,
            socialLinks,
            duplicate,
            duplicateOfLeadId,
            extractionStatus,
            enrichmentStatus,
            score,
            verificationScore,
            signalStrength,
            source,
            createdAt
        );
    }
}
