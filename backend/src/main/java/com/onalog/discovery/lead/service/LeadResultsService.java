package com.onalog.discovery.lead.service;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.collab.BillingClient;
import com.onalog.discovery.lead.model.Lead;
import com.onalog.discovery.lead.model.LeadQuery;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchResultsResponse;
import com.onalog.discovery.lead.persistence.LeadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Paged lead listing for one job. Tenants without any credit balance only see the first
 * {@code previewCap} leads.
 */
@Service
public class LeadResultsService {
    private static final Logger log = LoggerFactory.getLogger(LeadResultsService.class);

    private final SearchJobService searchJobService;
    private final LeadRepository leadRepository;
    private final BillingClient billingClient;
    private final DiscoveryProperties properties;

    public LeadResultsService(
        SearchJobService searchJobService,
        LeadRepository leadRepository,
        BillingClient billingClient,
        DiscoveryProperties properties
    ) {
        this.searchJobService = searchJobService;
        this.leadRepository = leadRepository;
        this.billingClient = billingClient;
        this.properties = properties;
    }

    public SearchResultsResponse results(
        String tenantId,
        long searchJobId,
        Integer page,
        Integer size,
        Integer minScore,
        String country,
        String industry
    ) {
        SearchJob job = searchJobService.get(tenantId, searchJobId);
        DiscoveryProperties.Results config = properties.getResults();
        int safePage = page == null ? 0 : Math.max(0, page);
        int safeSize = size == null
            ? config.getDefaultPageSize()
            : Math.max(1, Math.min(config.getMaxPageSize(), size));
        int offset = safePage * safeSize;
        int limit = safeSize;

        boolean preview = isPreviewOnly(job.tenantOwner());
        if (preview) {
            int cap = config.getPreviewCap();
            limit = Math.max(0, Math.min(safeSize, cap - offset));
        }
        LeadQuery query = new LeadQuery(limit, offset, minScore, country, industry);
        long total = leadRepository.countResults(searchJobId, query);
        List<Lead> leads = limit == 0 ? List.of() : leadRepository.findResults(searchJobId, query);
        return new SearchResultsResponse(job, leads, safePage, safeSize, total, preview && total > config.getPreviewCap());
    }

    private boolean isPreviewOnly(String tenant) {
        try {
            return billingClient.balance(tenant) == 0;
        } catch (RuntimeException e) {
            log.warn("Balance lookup failed for tenant {}, serving preview", tenant, e);
            return true;
        }
    }
}
