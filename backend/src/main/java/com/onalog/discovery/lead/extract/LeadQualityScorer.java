package com.onalog.discovery.lead.extract;

import com.onalog.discovery.lead.model.Lead;
import com.onalog.discovery.lead.util.HostnameNormalizer;

import java.util.Collection;

/**
 * One point each for: a specific name, a real website, a direct contact channel, a decision maker, and supporting
 * detail (address or social profiles). Range 0..5.
 */
public final class LeadQualityScorer {
    public static final int MAX_SCORE = 5;

    private LeadQualityScorer() {
    }

    public static int score(Lead lead) {
        int score = 0;
        if (!CompanyNameResolver.isGeneric(lead.companyName()) && !CompanyNameResolver.isRejected(lead.companyName())) {
            score++;
        }
        if (!HostnameNormalizer.isPlaceholderLink(lead.website())) {
            score++;
        }
        if (notEmpty(lead.emails()) || notEmpty(lead.phoneNumbers())) {
            score++;
        }
        if (notEmpty(lead.decisionMakers())) {
            score++;
        }
        boolean hasAddress = lead.address() != null && !lead.address().isBlank();
        boolean hasSocial = lead.socialLinks() != null && !lead.socialLinks().isEmpty();
        if (hasAddress || hasSocial) {
            score++;
        }
        return score;
    }

    private static boolean notEmpty(Collection<?> values) {
        return values != null && !values.isEmpty();
    }
}
