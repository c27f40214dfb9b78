package com.onalog.discovery.lead.service;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.collab.BillingClient;
import com.onalog.discovery.lead.model.NewSearchJob;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchRequest;
import com.onalog.discovery.lead.model.SearchTemplate;
import com.onalog.discovery.lead.model.SubmitSearchResponse;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import com.onalog.discovery.lead.queue.SearchQueueScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class SearchJobService {
    private static final Logger log = LoggerFactory.getLogger(SearchJobService.class);
    private static final Set<Integer> RESULT_COUNTS = Set.of(50, 100, 200);
    private static final int MAX_QUERY_LENGTH = 500;
    private static final int MAX_TENANT_LENGTH = 128;
    private static final int MAX_COUNTRY_LENGTH = 16;
    private static final int MAX_FILTER_LENGTH = 200;
    private static final int MAX_TEMPLATE_NAME_LENGTH = 200;
    private static final int MAX_LIST_LIMIT = 200;

    private final SearchJobRepository searchJobRepository;
    private final SearchQueueScheduler scheduler;
    private final BillingClient billingClient;
    private final DiscoveryProperties properties;

    public SearchJobService(
        SearchJobRepository searchJobRepository,
        SearchQueueScheduler scheduler,
        BillingClient billingClient,
        DiscoveryProperties properties
    ) {
        this.searchJobRepository = searchJobRepository;
        this.scheduler = scheduler;
        this.billingClient = billingClient;
        this.properties = properties;
    }

    public SubmitSearchResponse submit(String tenantId, SearchRequest request) {
        String tenant = tenantOrAnonymous(tenantId);
        requireMaxLength("tenant", tenant, MAX_TENANT_LENGTH);
        if (request == null || request.query() == null || request.query().isBlank()) {
            throw new InvalidSearchRequestException("query is required");
        }
        String query = request.query().trim();
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new InvalidSearchRequestException("query must be at most " + MAX_QUERY_LENGTH + " characters");
        }
        if (request.resultCount() == null || !RESULT_COUNTS.contains(request.resultCount())) {
            throw new InvalidSearchRequestException("resultCount must be one of 50, 100, 200");
        }
        String country = normalizeCountry(request.country());
        String location = blankToNull(request.location());
        String industry = blankToNull(request.industry());
        requireMaxLength("country", country, MAX_COUNTRY_LENGTH);
        requireMaxLength("location", location, MAX_FILTER_LENGTH);
        requireMaxLength("industry", industry, MAX_FILTER_LENGTH);
        int priority = priorityFor(tenant);
        long searchJobId = searchJobRepository.insert(new NewSearchJob(
            tenant,
            query,
            country,
            location,
            industry,
            request.resultCount(),
            priority
        ));
        int queuePosition = 0;
        int userQueuePosition = 0;
        if (scheduler.enqueue(searchJobId, tenant) != null) {
            queuePosition = scheduler.queuePosition(searchJobId);
            userQueuePosition = scheduler.userQueuePosition(searchJobId, tenant);
        }
        SearchJob job = searchJobRepository.findById(searchJobId);
        if (job == null) {
            throw new SearchJobNotFoundException(searchJobId);
        }
        log.info("Tenant {} submitted search job {} ('{}', target {})", tenant, searchJobId, query, request.resultCount());
        return new SubmitSearchResponse(searchJobId, job.status(), queuePosition, userQueuePosition, priority);
    }

    public SearchJob get(String tenantId, long searchJobId) {
        SearchJob job = searchJobRepository.findById(searchJobId);
        if (job == null || !job.tenantOwner().equals(tenantOrAnonymous(tenantId))) {
            throw new SearchJobNotFoundException(searchJobId);
        }
        return job;
    }

    public List<SearchJob> list(String tenantId, Integer limit) {
        int safeLimit = limit == null ? properties.getResults().getDefaultPageSize() : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return searchJobRepository.findByTenant(tenantOrAnonymous(tenantId), safeLimit);
    }

    /**
     * Deletes the job and, through the foreign key cascade, its leads. A queued job is also removed from
     * the scheduler; a running one stops at its next existence check.
     */
    public void delete(String tenantId, long searchJobId) {
        get(tenantId, searchJobId);
        scheduler.cancel(searchJobId);
        searchJobRepository.delete(searchJobId);
        log.info("Deleted search job {}", searchJobId);
    }

    public SearchTemplate saveTemplate(String tenantId, long searchJobId, String name) {
        SearchJob job = get(tenantId, searchJobId);
        String templateName;
        if (name == null || name.isBlank()) {
            String query = job.queryText();
            templateName = query.length() > MAX_TEMPLATE_NAME_LENGTH ? query.substring(0, MAX_TEMPLATE_NAME_LENGTH).trim() : query;
        } else {
            templateName = name.trim();
            requireMaxLength("name", templateName, MAX_TEMPLATE_NAME_LENGTH);
        }
        long templateId = searchJobRepository.insertTemplate(job.tenantOwner(), templateName, job);
        return searchJobRepository.findTemplates(job.tenantOwner()).stream()
            .filter(template -> template.id() == templateId)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("saved template " + templateId + " not readable"));
    }

    public List<SearchTemplate> templates(String tenantId) {
        return searchJobRepository.findTemplates(tenantOrAnonymous(tenantId));
    }

    String tenantOrAnonymous(String tenantId) {
        return tenantId == null || tenantId.isBlank()
            ? properties.getScheduler().getAnonymousTenant()
            : tenantId.trim();
    }

    private int priorityFor(String tenant) {
        try {
            return billingClient.hasPurchasedCredits(tenant) ? properties.getScheduler().getCreditedPriority() : 0;
        } catch (RuntimeException e) {
            log.warn("Billing lookup failed for tenant {}, using default priority", tenant, e);
            return 0;
        }
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new InvalidSearchRequestException(field + " must be at most " + max + " characters");
        }
    }

    private static String normalizeCountry(String country) {
        String value = blankToNull(country);
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
