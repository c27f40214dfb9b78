package com.onalog.discovery.lead.pipeline;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.model.ExtractionOutcome;
import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgressiveExtractionPipelineTest {
    private final CandidateExtractionService extraction = Mockito.mock(CandidateExtractionService.class);
    private final SearchJobRepository repository = Mockito.mock(SearchJobRepository.class);
    private final AtomicInteger saved = new AtomicInteger();
    private final DiscoveryProperties properties = new DiscoveryProperties();

    private ExecutorService extractionExecutor;
    private ExecutorService backfillExecutor;
    private ScheduledExecutorService timer;
    private BackgroundFillRegistry registry;
    private ProgressiveExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        extractionExecutor = Executors.newFixedThreadPool(4);
        backfillExecutor = Executors.newSingleThreadExecutor();
        timer = Executors.newSingleThreadScheduledExecutor();
        registry = new BackgroundFillRegistry(timer, properties);
        pipeline = new ProgressiveExtractionPipeline(
            extraction,
            repository,
            registry,
            extractionExecutor,
            backfillExecutor,
            properties
        );
        when(repository.exists(anyLong())).thenReturn(true);
        when(repository.extractedCount(anyLong())).thenAnswer(invocation -> saved.get());
    }

    @AfterEach
    void tearDown() {
        extractionExecutor.shutdownNow();
        backfillExecutor.shutdownNow();
        timer.shutdownNow();
    }

    @Test
    void smallResultSetsCompleteInForeground() {
        savesEverything();
        SearchJob job = PipelineFixtures.job(1L, 50);

        ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(job, PipelineFixtures.candidates(10));

        assertThat(result.extracted()).isEqualTo(10);
        assertThat(result.backgroundQueued()).isZero();
        verify(repository).updateTotalResults(1L, 10);
        verify(repository).updateStatus(1L, SearchJobStatus.EXTRACTING);
        verify(repository).markCompleted(1L);
        verify(repository, never()).updateStatus(1L, SearchJobStatus.PROCESSING_BACKFILL);
        assertThat(registry.isRegistered(1L)).isFalse();
    }

    @Test
    void backgroundFillStopsAtResultTarget() throws Exception {
        savesEverything();
        SearchJob job = PipelineFixtures.job(2L, 50);

        ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(job, PipelineFixtures.candidates(80));
        backfillExecutor.shutdown();
        assertThat(backfillExecutor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(result.extracted()).isEqualTo(30);
        assertThat(result.backgroundQueued()).isEqualTo(20);
        assertThat(saved.get()).isEqualTo(50);
        verify(repository, atLeastOnce()).updateStatus(2L, SearchJobStatus.PROCESSING_BACKFILL);
        verify(repository).markCompleted(2L);
        verify(extraction).release(2L);
        assertThat(registry.isRegistered(2L)).isFalse();
    }

    @Test
    void unsavedForegroundCandidatesStillRollIntoBackground() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(extraction.process(any(), any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() % 2 == 0) {
                saved.incrementAndGet();
                return ExtractionOutcome.SAVED;
            }
            return ExtractionOutcome.REJECTED;
        });
        SearchJob job = PipelineFixtures.job(8L, 100);

        ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(job, PipelineFixtures.candidates(100));
        backfillExecutor.shutdown();
        assertThat(backfillExecutor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(result.extracted()).isEqualTo(15);
        assertThat(result.backgroundQueued()).isEqualTo(70);
        assertThat(calls.get()).isEqualTo(100);
        assertThat(saved.get()).isEqualTo(50);
        verify(repository).markCompleted(8L);
    }

    @Test
    void foregroundDeadlineWaitsForInFlightExtractions() {
        properties.getPipeline().setForegroundDeadlineSeconds(1);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        when(extraction.process(any(), any())).thenAnswer(invocation -> {
            inFlight.incrementAndGet();
            calls.incrementAndGet();
            try {
                Thread.sleep(1500);
            } finally {
                inFlight.decrementAndGet();
            }
            saved.incrementAndGet();
            return ExtractionOutcome.SAVED;
        });
        long startedAt = System.nanoTime();

        ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(PipelineFixtures.job(9L, 50), PipelineFixtures.candidates(8));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(1500);
        assertThat(inFlight.get()).isZero();
        assertThat(calls.get()).isEqualTo(4);
        assertThat(result.extracted()).isEqualTo(4);
        verify(repository).markCompleted(9L);
    }

    @Test
    void duplicateCandidatesAreCollapsedBeforeExtraction() {
        savesEverything();
        List<LeadCandidate> candidates = new ArrayList<>(PipelineFixtures.candidates(5));
        candidates.add(LeadCandidate.of("Cafe 0 again", "https://www.cafe-0.co.ke/menu", "", "nominatim"));

        ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(PipelineFixtures.job(3L, 50), candidates);

        assertThat(result.candidates()).isEqualTo(5);
        verify(repository).updateTotalResults(3L, 5);
    }

    @Test
    void deletedJobStopsForegroundWithoutCompleting() {
        when(extraction.process(any(), any())).thenReturn(ExtractionOutcome.JOB_MISSING);

        ProgressiveExtractionPipeline.ForegroundResult result = pipeline.runForeground(PipelineFixtures.job(4L, 50), PipelineFixtures.candidates(8));

        assertThat(result.jobMissing()).isTrue();
        verify(repository, never()).markCompleted(4L);
        verify(extraction).release(4L);
    }

    @Test
    void pausedBackgroundFillWritesNothingUntilResumed() throws Exception {
        savesEverything();
        SearchJob job = PipelineFixtures.job(5L, 50);
        PauseGate gate = registry.register(5L);
        registry.pauseAll();
        CountDownLatch finished = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            pipeline.runBackground(job, PipelineFixtures.candidates(5), gate);
            finished.countDown();
        });
        worker.start();

        assertThat(finished.await(300, TimeUnit.MILLISECONDS)).isFalse();
        verify(extraction, never()).process(any(), any());
        assertThat(registry.pausedJobIds()).containsExactly(5L);

        registry.resumeAll();

        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(saved.get()).isEqualTo(5);
        verify(repository).markCompleted(5L);
        assertThat(registry.isRegistered(5L)).isFalse();
    }

    @Test
    void capReachedInBackgroundEndsTheFill() {
        when(extraction.process(any(), any())).thenReturn(ExtractionOutcome.CAP_REACHED);
        PauseGate gate = registry.register(6L);

        pipeline.runBackground(PipelineFixtures.job(6L, 50), PipelineFixtures.candidates(5), gate);

        verify(extraction, Mockito.times(1)).process(any(), any());
        verify(repository).markCompleted(6L);
    }

    @Test
    void backgroundFailureMarksJobFailed() {
        when(extraction.process(any(), any())).thenReturn(ExtractionOutcome.SAVED);
        Mockito.doThrow(new IllegalStateException("db down")).when(repository).syncCounters(eq(7L));
        PauseGate gate = registry.register(7L);

        pipeline.runBackground(PipelineFixtures.job(7L, 50), PipelineFixtures.candidates(3), gate);

        verify(repository).markFailed(7L, "db down");
        assertThat(registry.isRegistered(7L)).isFalse();
    }

    private void savesEverything() {
        when(extraction.process(any(), any())).thenAnswer(invocation -> {
            saved.incrementAndGet();
            return ExtractionOutcome.SAVED;
        });
    }
}
