package com.onalog.discovery.lead.collab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Fail-open defaults for the external collaborators. A deployment that wires the real AI or billing services
 * declares its own beans and these back off.
 */
@Configuration
public class CollaboratorConfig {
    private static final Logger log = LoggerFactory.getLogger(CollaboratorConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public EnrichmentClient enrichmentClient() {
        log.info("No enrichment service configured; leads keep extracted data only");
        return lead -> EnrichmentResult.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public RelevanceClient relevanceClient() {
        return (candidate, query, industry) -> RelevanceVerdict.assumeRelevant("relevance_service_not_configured");
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentClassifier intentClassifier() {
        return query -> false;
    }

    @Bean
    @ConditionalOnMissingBean
    public TermExpansionClient termExpansionClient() {
        return (query, locale) -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean
    public LinkExtractionClient linkExtractionClient() {
        return (html, pageUrl, max) -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean
    public BillingClient billingClient() {
        log.info("No billing service configured; credits are unlimited");
        return new BillingClient() {
            @Override
            public CreditReservation reserveCredit(String tenantId, long searchJobId) {
                return CreditReservation.granted();
            }

            @Override
            public void refundCredit(String tenantId, long searchJobId, String reason) {
                log.debug("Refund ignored for tenant {} job {} ({})", tenantId, searchJobId, reason);
            }

            @Override
            public long balance(String tenantId) {
                return Long.MAX_VALUE;
            }

            @Override
            public boolean hasPurchasedCredits(String tenantId) {
                return false;
            }
        };
    }
}
