package com.onalog.discovery.lead.dedupe;

import com.onalog.discovery.lead.model.DuplicateCheckResult;
import com.onalog.discovery.lead.persistence.LeadRepository;
import com.onalog.discovery.lead.util.HostnameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a freshly extracted lead repeats one already saved in the same search job. Matches in other
 * jobs are logged but never suppress a lead, so re-running a query returns a full result set.
 */
@Service
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);
    static final double NAME_SIMILARITY_THRESHOLD = 0.85;
    private static final int MIN_NAME_LENGTH = 4;

    private final LeadRepository leadRepository;

    public DuplicateDetector(LeadRepository leadRepository) {
        this.leadRepository = leadRepository;
    }

    public DuplicateCheckResult detect(String website, String companyName, long searchJobId) {
        DuplicateCheckResult match = scan(website, companyName, searchJobId);
        if (match.duplicate() && !leadRepository.existsNonDuplicate(match.duplicateOfLeadId(), searchJobId)) {
            log.debug(
                "Duplicate target {} vanished for job {}; rescanning",
                match.duplicateOfLeadId(),
                searchJobId
            );
            match = scan(website, companyName, searchJobId);
        }
        if (!match.duplicate()) {
            int otherJobs = crossJobMatches(website, searchJobId);
            if (otherJobs > 0) {
                log.debug("Host of {} already appears in {} other search job(s); keeping for job {}", website, otherJobs, searchJobId);
            }
        }
        return match;
    }

    public int crossJobMatches(String website, long searchJobId) {
        if (HostnameNormalizer.isPlaceholderLink(website)) {
            return 0;
        }
        String host = HostnameNormalizer.normalize(website);
        return host.isEmpty() ? 0 : leadRepository.countOtherJobsWithHost(searchJobId, host);
    }

    private DuplicateCheckResult scan(String website, String companyName, long searchJobId) {
        String host = HostnameNormalizer.isPlaceholderLink(website) ? "" : HostnameNormalizer.normalize(website);
        if (!host.isEmpty()) {
            Long sameHost = leadRepository.findNonDuplicateIdByHost(searchJobId, host);
            if (sameHost != null) {
                return DuplicateCheckResult.byWebsite(sameHost);
            }
        }
        if (companyName == null || companyName.trim().length() < MIN_NAME_LENGTH) {
            return DuplicateCheckResult.unique();
        }
        for (LeadRepository.LeadName existing : leadRepository.findNonDuplicateNames(searchJobId)) {
            if (NameSimilarity.ratio(companyName, existing.companyName()) > NAME_SIMILARITY_THRESHOLD) {
                return DuplicateCheckResult.byName(existing.id());
            }
        }
        return DuplicateCheckResult.unique();
    }
}
