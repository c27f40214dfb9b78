package com.onalog.discovery.lead.queue;

import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchOutcome;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import com.onalog.discovery.lead.pipeline.ProgressiveExtractionPipeline;
import com.onalog.discovery.lead.search.SearchOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the foreground phase of one search job: provider search, then progressive extraction.
 * Anything thrown here marks the job failed; leads already persisted stay in place.
 */
@Service
public class SearchJobProcessor {
    private static final Logger log = LoggerFactory.getLogger(SearchJobProcessor.class);

    private final SearchJobRepository searchJobRepository;
    private final SearchOrchestratorService searchOrchestratorService;
    private final ProgressiveExtractionPipeline pipeline;

    public SearchJobProcessor(
        SearchJobRepository searchJobRepository,
        SearchOrchestratorService searchOrchestratorService,
        ProgressiveExtractionPipeline pipeline
    ) {
        this.searchJobRepository = searchJobRepository;
        this.searchOrchestratorService = searchOrchestratorService;
        this.pipeline = pipeline;
    }

    public void process(long searchJobId) {
        SearchJob job = searchJobRepository.findById(searchJobId);
        if (job == null) {
            log.warn("Search job {} no longer exists, skipping", searchJobId);
            return;
        }
        if (job.status().isTerminal()) {
            log.info("Search job {} already {}, skipping", searchJobId, job.status().dbValue());
            return;
        }
        long started = System.currentTimeMillis();
        try {
            searchJobRepository.markStarted(searchJobId);
            log.info("Search job {} started for tenant {}: '{}'", searchJobId, job.tenantOwner(), job.queryText());
            SearchOutcome outcome = searchOrchestratorService.search(
                job.queryText(),
                job.countryFilter(),
                job.locationFilter(),
                job.resultTarget()
            );
            searchJobRepository.recordSearchOutcome(
                searchJobId,
                outcome.results().size(),
                outcome.telemetry(),
                outcome.shortfallReason()
            );
            ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(job, outcome.results());
            log.info(
                "Search job {} foreground done in {} ms: candidates={} extracted={} background={}",
                searchJobId,
                System.currentTimeMillis() - started,
                result.candidates(),
                result.extracted(),
                result.backgroundQueued()
            );
        } catch (Exception e) {
            log.warn("Search job {} failed", searchJobId, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            searchJobRepository.markFailed(searchJobId, message);
        }
    }
}
