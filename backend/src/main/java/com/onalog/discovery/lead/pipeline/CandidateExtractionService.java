package com.onalog.discovery.lead.pipeline;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.classify.DirectoryClassifier;
import com.onalog.discovery.lead.classify.DirectorySites;
import com.onalog.discovery.lead.classify.SocialMediaSites;
import com.onalog.discovery.lead.collab.BillingClient;
import com.onalog.discovery.lead.collab.CreditReservation;
import com.onalog.discovery.lead.collab.EnrichmentClient;
import com.onalog.discovery.lead.collab.EnrichmentResult;
import com.onalog.discovery.lead.collab.RelevanceClient;
import com.onalog.discovery.lead.collab.RelevanceVerdict;
import com.onalog.discovery.lead.dedupe.DuplicateDetector;
import com.onalog.discovery.lead.extract.CompanyNameResolver;
import com.onalog.discovery.lead.extract.ContactExtractionService;
import com.onalog.discovery.lead.extract.LeadQualityScorer;
import com.onalog.discovery.lead.model.ClassificationResult;
import com.onalog.discovery.lead.model.DecisionMaker;
import com.onalog.discovery.lead.model.DuplicateCheckResult;
import com.onalog.discovery.lead.model.EnrichmentStatus;
import com.onalog.discovery.lead.model.ExtractionOutcome;
import com.onalog.discovery.lead.model.ExtractionStatus;
import com.onalog.discovery.lead.model.Lead;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.PageExtraction;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.persistence.LeadRepository;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Turns one search candidate into at most one persisted lead: extraction, validation, duplicate detection,
 * insert, credit reservation and enrichment.
 */
@Service
public class CandidateExtractionService {
    private static final Logger log = LoggerFactory.getLogger(CandidateExtractionService.class);
    static final String REFUND_INVALID = "refund_invalid";
    static final String REFUND_ENRICHMENT_FAILED = "enrichment_failed";
    static final int MAX_WEBSITE_LENGTH = 2048;
    static final int MAX_ADDRESS_LENGTH = 500;
    static final int MAX_INDUSTRY_LENGTH = 200;
    private static final Pattern BUSINESS_TYPE_QUERY = Pattern.compile(
        "\\b(restaurant|hospital|clinic|school|university|store|shop|company|business|agency|firm)s?\\b",
        Pattern.CASE_INSENSITIVE
    );

    private final ContactExtractionService contactExtractionService;
    private final DirectoryClassifier directoryClassifier;
    private final DuplicateDetector duplicateDetector;
    private final WebsiteLockRegistry websiteLockRegistry;
    private final LeadRepository leadRepository;
    private final SearchJobRepository searchJobRepository;
    private final RelevanceClient relevanceClient;
    private final EnrichmentClient enrichmentClient;
    private final BillingClient billingClient;
    private final DiscoveryProperties properties;
    private final Map<Long, Object> jobMonitors = new ConcurrentHashMap<>();

    public CandidateExtractionService(
        ContactExtractionService contactExtractionService,
        DirectoryClassifier directoryClassifier,
        DuplicateDetector duplicateDetector,
        WebsiteLockRegistry websiteLockRegistry,
        LeadRepository leadRepository,
        SearchJobRepository searchJobRepository,
        RelevanceClient relevanceClient,
        EnrichmentClient enrichmentClient,
        BillingClient billingClient,
        DiscoveryProperties properties
    ) {
        this.contactExtractionService = contactExtractionService;
        this.directoryClassifier = directoryClassifier;
        this.duplicateDetector = duplicateDetector;
        this.websiteLockRegistry = websiteLockRegistry;
        this.leadRepository = leadRepository;
        this.searchJobRepository = searchJobRepository;
        this.relevanceClient = relevanceClient;
        this.enrichmentClient = enrichmentClient;
        this.billingClient = billingClient;
        this.properties = properties;
    }

    public ExtractionOutcome process(SearchJob job, LeadCandidate candidate) {
        String link = candidate.link();
        boolean placeholder = HostnameNormalizer.isPlaceholderLink(link);
        String host = placeholder ? "" : HostnameNormalizer.normalize(link);
        Duration lockWait = Duration.ofSeconds(properties.getPipeline().getHostLockWaitSeconds());
        try (WebsiteLockRegistry.HostLock lock = host.isEmpty()
            ? websiteLockRegistry.unlocked()
            : websiteLockRegistry.acquire(job.id(), host, lockWait)) {
            if (lock.waited() && leadRepository.findNonDuplicateIdByHost(job.id(), host) != null) {
                log.debug("Host {} was saved for job {} while waiting; skipping", host, job.id());
                return ExtractionOutcome.DUPLICATE;
            }
            if (!searchJobRepository.exists(job.id())) {
                return ExtractionOutcome.JOB_MISSING;
            }
            if (capReached(job)) {
                return ExtractionOutcome.CAP_REACHED;
            }
            if (!placeholder && rejectedByUrl(link)) {
                log.debug("Rejected {} for job {}: article, social or directory url", link, job.id());
                return ExtractionOutcome.REJECTED;
            }

            PageExtraction page = placeholder ? fromProvider(candidate) : contactExtractionService.extract(link);
            String companyName = CompanyNameResolver.resolve(page.companyName(), candidate.title(), link);
            if (CompanyNameResolver.isRejected(companyName)) {
                log.debug("Rejected {} for job {}: unusable company name '{}'", link, job.id(), companyName);
                return ExtractionOutcome.REJECTED;
            }
            ClassificationResult classification = page.classification();
            if (!placeholder && directoryClassifier.isRejected(classification)) {
                log.debug("Rejected {} for job {}: directory page {}", link, job.id(), classification.reasons());
                return ExtractionOutcome.REJECTED;
            }
            if (!passesRelevanceGate(job, candidate)) {
                return ExtractionOutcome.REJECTED;
            }

            Lead lead = buildLead(job, candidate, page, companyName);
            lead = lead.withQualityScore(LeadQualityScorer.score(lead));
            return persist(job, lead, link, companyName);
        }
    }

    /**
     * Drops per-job bookkeeping once a job stops producing leads.
     */
    public void release(long searchJobId) {
        jobMonitors.remove(searchJobId);
    }

    private ExtractionOutcome persist(SearchJob job, Lead lead, String link, String companyName) {
        Lead saved;
        synchronized (jobMonitors.computeIfAbsent(job.id(), ignored -> new Object())) {
            if (capReached(job)) {
                return ExtractionOutcome.CAP_REACHED;
            }
            Lead candidateLead = lead.withDuplicate(duplicateDetector.detect(link, companyName, job.id()));
            try {
                saved = candidateLead.withId(leadRepository.insert(candidateLead));
            } catch (DuplicateKeyException e) {
                log.info("Lead insert for {} in job {} raced another worker; re-running duplicate detection", link, job.id());
                DuplicateCheckResult recheck = duplicateDetector.detect(link, companyName, job.id());
                candidateLead = lead.withDuplicate(recheck);
                try {
                    saved = candidateLead.withId(leadRepository.insert(candidateLead));
                } catch (DuplicateKeyException second) {
                    log.warn("Lead insert for {} in job {} conflicted twice; dropping", link, job.id(), second);
                    return ExtractionOutcome.DUPLICATE;
                } catch (DataIntegrityViolationException second) {
                    return insertFailed(job, link, second);
                }
            } catch (DataIntegrityViolationException e) {
                return insertFailed(job, link, e);
            }
            if (saved.duplicate()) {
                return ExtractionOutcome.DUPLICATE;
            }
            searchJobRepository.syncCounters(job.id());
        }
        enrich(job, saved);
        return ExtractionOutcome.SAVED;
    }

    private ExtractionOutcome insertFailed(SearchJob job, String link, DataIntegrityViolationException e) {
        if (!searchJobRepository.exists(job.id())) {
            return ExtractionOutcome.JOB_MISSING;
        }
        log.warn("Lead insert for {} in job {} failed", link, job.id(), e);
        return ExtractionOutcome.FAILED;
    }

    private void enrich(SearchJob job, Lead lead) {
        CreditReservation reservation;
        try {
            reservation = billingClient.reserveCredit(job.tenantOwner(), job.id());
        } catch (RuntimeException e) {
            log.warn("Credit reservation failed for job {}", job.id(), e);
            reservation = CreditReservation.denied("billing_unavailable");
        }
        if (reservation == null || !reservation.ok()) {
            leadRepository.updateEnrichmentStatus(lead.id(), EnrichmentStatus.SKIPPED);
            return;
        }
        searchJobRepository.updateStatus(job.id(), SearchJobStatus.ENRICHING);
        leadRepository.updateEnrichmentStatus(lead.id(), EnrichmentStatus.ENRICHING);
        EnrichmentResult result;
        try {
            result = enrichmentClient.enrich(lead);
            leadRepository.applyEnrichment(lead.id(), result == null ? EnrichmentResult.empty() : result);
        } catch (RuntimeException e) {
            log.warn("Enrichment failed for lead {} in job {}", lead.id(), job.id(), e);
            leadRepository.updateEnrichmentStatus(lead.id(), EnrichmentStatus.FAILED);
            refund(job, REFUND_ENRICHMENT_FAILED);
            return;
        }
        List<DecisionMaker> decisionMakers = result != null && result.decisionMakers() != null
            && !result.decisionMakers().isEmpty() ? result.decisionMakers() : lead.decisionMakers();
        if (decisionMakers == null || decisionMakers.stream().noneMatch(DecisionMaker::hasEmail)) {
            refund(job, REFUND_INVALID);
        }
        searchJobRepository.syncCounters(job.id());
    }

    private void refund(SearchJob job, String reason) {
        try {
            billingClient.refundCredit(job.tenantOwner(), job.id(), reason);
        } catch (RuntimeException e) {
            log.warn("Credit refund ({}) failed for job {}", reason, job.id(), e);
        }
    }

    private boolean capReached(SearchJob job) {
        return leadRepository.countNonDuplicate(job.id()) >= job.resultTarget();
    }

    private boolean rejectedByUrl(String link) {
        return DirectorySites.isArticlePage(link)
            || SocialMediaSites.isSocialMediaUrl(link)
            || DirectorySites.isDirectorySite(link);
    }

    private boolean passesRelevanceGate(SearchJob job, LeadCandidate candidate) {
        String context = job.queryText() + " " + (job.industryHint() == null ? "" : job.industryHint());
        if (!BUSINESS_TYPE_QUERY.matcher(context).find()) {
            return true;
        }
        RelevanceVerdict verdict;
        try {
            verdict = relevanceClient.isRelevant(candidate, job.queryText(), job.industryHint());
        } catch (RuntimeException e) {
            log.warn("Relevance check failed for {}; keeping candidate", candidate.link(), e);
            return true;
        }
        if (verdict != null
            && !verdict.relevant()
            && verdict.confidence() > properties.getPipeline().getRelevanceRejectConfidence()) {
            log.debug("Rejected {} for job {}: irrelevant ({})", candidate.link(), job.id(), verdict.reason());
            return false;
        }
        return true;
    }

    private Lead buildLead(SearchJob job, LeadCandidate candidate, PageExtraction page, String companyName) {
        LinkedHashSet<String> phones = new LinkedHashSet<>();
        if (candidate.phone() != null && !candidate.phone().isBlank()) {
            phones.add(candidate.phone().trim());
        }
        phones.addAll(page.phones());
        String address = candidate.address() != null && !candidate.address().isBlank()
            ? candidate.address().trim()
            : page.address();
        return new Lead(
            null,
            job.id(),
            companyName,
            websiteWithinLimit(candidate.link()),
            page.emails(),
            new ArrayList<>(phones),
            clip(address, MAX_ADDRESS_LENGTH),
            job.countryFilter(),
            clip(job.industryHint(), MAX_INDUSTRY_LENGTH),
            page.decisionMakers(),
            page.socialLinks(),
            false,
            null,
            page.fetchFailed() ? ExtractionStatus.FAILED : ExtractionStatus.EXTRACTED,
            EnrichmentStatus.PENDING,
            null,
            null,
            null,
            candidate.source(),
            null
        );
    }

    static String websiteWithinLimit(String link) {
        if (link == null || link.length() <= MAX_WEBSITE_LENGTH) {
            return link;
        }
        int cut = link.indexOf('?');
        if (cut < 0) {
            cut = link.indexOf('#');
        }
        String trimmed = cut > 0 ? link.substring(0, cut) : link;
        return clip(trimmed, MAX_WEBSITE_LENGTH);
    }

    static String clip(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max).trim();
    }

    private static PageExtraction fromProvider(LeadCandidate candidate) {
        return new PageExtraction(
            candidate.link(),
            candidate.title(),
            List.of(),
            List.of(),
            candidate.address(),
            List.of(),
            Map.of(),
            ClassificationResult.fallback(),
            false
        );
    }
}
