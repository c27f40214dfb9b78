package com.onalog.discovery.lead.pipeline;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.model.ExtractionOutcome;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import com.onalog.discovery.lead.search.SearchResultMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Extracts a job's candidates in two phases. A small foreground batch runs under a deadline while the job holds
 * the scheduler; whatever is left continues one candidate at a time in the background, pausable by the
 * scheduler, until the job's result target is met.
 */
@Service
public class ProgressiveExtractionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ProgressiveExtractionPipeline.class);

    private final CandidateExtractionService candidateExtractionService;
    private final SearchJobRepository searchJobRepository;
    private final BackgroundFillRegistry backgroundFillRegistry;
    private final ExecutorService extractionExecutor;
    private final ExecutorService backfillExecutor;
    private final DiscoveryProperties properties;

    public ProgressiveExtractionPipeline(
        CandidateExtractionService candidateExtractionService,
        SearchJobRepository searchJobRepository,
        BackgroundFillRegistry backgroundFillRegistry,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
        @Qualifier("backfillExecutor") ExecutorService backfillExecutor,
        DiscoveryProperties properties
    ) {
        this.candidateExtractionService = candidateExtractionService;
        this.searchJobRepository = searchJobRepository;
        this.backgroundFillRegistry = backgroundFillRegistry;
        this.extractionExecutor = extractionExecutor;
        this.backfillExecutor = backfillExecutor;
        this.properties = properties;
    }

    public record ForegroundResult(int candidates, int extracted, int backgroundQueued, boolean jobMissing) {
    }

    public ForegroundResult runForeground(SearchJob job, List<LeadCandidate> candidates) {
        DiscoveryProperties.Pipeline pipeline = properties.getPipeline();
        List<LeadCandidate> unique = SearchResultMerger.dedupe(candidates);
        searchJobRepository.updateTotalResults(job.id(), unique.size());
        searchJobRepository.updateStatus(job.id(), SearchJobStatus.EXTRACTING);

        int batchSize = Math.min(pipeline.getInitialBatchSize(), unique.size());
        ConcurrentLinkedQueue<LeadCandidate> batch = new ConcurrentLinkedQueue<>(unique.subList(0, batchSize));
        List<LeadCandidate> rest = unique.subList(batchSize, unique.size());
        AtomicBoolean stop = new AtomicBoolean(false);
        AtomicBoolean jobMissing = new AtomicBoolean(false);

        if (batchSize > 0) {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(pipeline.getForegroundDeadlineSeconds());
            int workers = Math.min(pipeline.getWorkerCount(), batchSize);
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                futures.add(CompletableFuture.runAsync(
                    () -> drain(job, batch, deadline, stop, jobMissing),
                    extractionExecutor
                ));
            }
            awaitForeground(job, futures, deadline, stop);
        }

        if (jobMissing.get() || !searchJobRepository.exists(job.id())) {
            log.info("Job {} was deleted during foreground extraction", job.id());
            candidateExtractionService.release(job.id());
            return new ForegroundResult(unique.size(), 0, 0, true);
        }
        searchJobRepository.syncCounters(job.id());
        int extracted = searchJobRepository.extractedCount(job.id());

        List<LeadCandidate> remaining = new ArrayList<>(batch);
        remaining.addAll(rest);
        int slots = Math.max(0, job.resultTarget() - extracted);
        if (unique.size() < pipeline.getBackgroundMinCandidates() || remaining.isEmpty() || slots == 0) {
            log.info("Job {} completed in foreground with {} leads from {} candidates", job.id(), extracted, unique.size());
            searchJobRepository.markCompleted(job.id());
            candidateExtractionService.release(job.id());
            return new ForegroundResult(unique.size(), extracted, 0, false);
        }
        List<LeadCandidate> background = remaining.size() > slots
            ? new ArrayList<>(remaining.subList(0, slots))
            : remaining;
        startBackground(job, background);
        return new ForegroundResult(unique.size(), extracted, background.size(), false);
    }

    private void drain(
        SearchJob job,
        ConcurrentLinkedQueue<LeadCandidate> batch,
        long deadline,
        AtomicBoolean stop,
        AtomicBoolean jobMissing
    ) {
        while (!stop.get() && System.nanoTime() < deadline) {
            LeadCandidate candidate = batch.poll();
            if (candidate == null) {
                return;
            }
            ExtractionOutcome outcome = processSafely(job, candidate);
            if (outcome == ExtractionOutcome.JOB_MISSING) {
                jobMissing.set(true);
                stop.set(true);
            } else if (outcome == ExtractionOutcome.CAP_REACHED) {
                stop.set(true);
            }
        }
    }

    private void awaitForeground(
        SearchJob job,
        List<CompletableFuture<Void>> futures,
        long deadline,
        AtomicBoolean stop
    ) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            all.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            stop.set(true);
            log.info("Foreground deadline reached for job {}; waiting for in-flight extractions", job.id());
            joinWorkers(job, all);
        } catch (InterruptedException e) {
            stop.set(true);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Foreground extraction worker failed for job {}", job.id(), e.getCause());
        }
        stop.set(true);
    }

    // Page fetches carry their own timeouts, so in-flight items always finish.
    private void joinWorkers(SearchJob job, CompletableFuture<Void> all) {
        try {
            all.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Foreground extraction worker failed for job {}", job.id(), e.getCause());
        }
    }

    private void startBackground(SearchJob job, List<LeadCandidate> background) {
        PauseGate gate = backgroundFillRegistry.register(job.id());
        searchJobRepository.updateStatus(job.id(), SearchJobStatus.PROCESSING_BACKFILL);
        log.info("Job {} continues in background with {} candidates", job.id(), background.size());
        backfillExecutor.execute(() -> runBackground(job, background, gate));
    }

    void runBackground(SearchJob job, List<LeadCandidate> background, PauseGate gate) {
        try {
            for (LeadCandidate candidate : background) {
                if (!searchJobRepository.exists(job.id())) {
                    log.info("Job {} was deleted; stopping background fill", job.id());
                    return;
                }
                if (searchJobRepository.extractedCount(job.id()) >= job.resultTarget()) {
                    break;
                }
                if (!gate.awaitIfPaused()) {
                    log.info("Background fill for job {} interrupted", job.id());
                    return;
                }
                ExtractionOutcome outcome = processSafely(job, candidate);
                if (outcome == ExtractionOutcome.JOB_MISSING) {
                    return;
                }
                searchJobRepository.syncCounters(job.id());
                searchJobRepository.updateStatus(job.id(), SearchJobStatus.PROCESSING_BACKFILL);
                if (outcome == ExtractionOutcome.CAP_REACHED) {
                    break;
                }
            }
            searchJobRepository.syncCounters(job.id());
            searchJobRepository.markCompleted(job.id());
            log.info("Background fill for job {} completed with {} leads", job.id(), searchJobRepository.extractedCount(job.id()));
        } catch (RuntimeException e) {
            log.warn("Background fill for job {} failed", job.id(), e);
            searchJobRepository.markFailed(job.id(), e.getMessage());
        } finally {
            backgroundFillRegistry.deregister(job.id());
            candidateExtractionService.release(job.id());
        }
    }

    private ExtractionOutcome processSafely(SearchJob job, LeadCandidate candidate) {
        try {
            return candidateExtractionService.process(job, candidate);
        } catch (RuntimeException e) {
            log.warn("Extraction failed for {} in job {}", candidate.link(), job.id(), e);
            return ExtractionOutcome.REJECTED;
        }
    }
}
