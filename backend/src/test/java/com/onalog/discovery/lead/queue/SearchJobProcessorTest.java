package com.onalog.discovery.lead.queue;

import com.onalog.discovery.lead.model.LeadCandidate;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.model.SearchOutcome;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import com.onalog.discovery.lead.pipeline.ProgressiveExtractionPipeline;
import com.onalog.discovery.lead.search.SearchOrchestratorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchJobProcessorTest {

    @Mock
    private SearchJobRepository repository;

    @Mock
    private SearchOrchestratorService orchestrator;

    @Mock
    private ProgressiveExtractionPipeline pipeline;

    @InjectMocks
    private SearchJobProcessor processor;

    @Test
    void runsSearchThenForegroundExtraction() {
        SearchJob job = job(SearchJobStatus.QUEUED);
        List<LeadCandidate> results = List.of(LeadCandidate.of("Acme", "https://acme.co.ke", "", "bing"));
        when(repository.findById(1L)).thenReturn(job);
        when(orchestrator.search("cafes", "ke", "Nairobi", 50))
            .thenReturn(new SearchOutcome(results, Map.of("bing", 1), "found 1 of 50 requested results"));
        when(pipeline.runForeground(job, results)).thenReturn(new ProgressiveExtractionPipeline.ForegroundResult(1, 1, 0, false));

        processor.process(1L);

        verify(repository).markStarted(1L);
        verify(repository).recordSearchOutcome(1L, 1, Map.of("bing", 1), "found 1 of 50 requested results");
        verify(repository, never()).markFailed(anyLong(), anyString());
    }

    @Test
    void skipsTerminalJobs() {
        when(repository.findById(1L)).thenReturn(job(SearchJobStatus.COMPLETED));

        processor.process(1L);

        verify(repository, never()).markStarted(1L);
        verifyNoInteractions(orchestrator, pipeline);
    }

    @Test
    void searchFailureMarksJobFailed() {
        when(repository.findById(1L)).thenReturn(job(SearchJobStatus.PENDING));
        when(orchestrator.search(anyString(), anyString(), anyString(), anyInt()))
            .thenThrow(new IllegalStateException("all providers down"));

        processor.process(1L);

        verify(repository).markFailed(1L, "all providers down");
        verifyNoInteractions(pipeline);
    }

    private static SearchJob job(SearchJobStatus status) {
        Instant now = Instant.now();
        return new SearchJob(1L, "tenant-a", "cafes", "ke", "Nairobi", null, 50, 0, status,
            0, 0, 0, Map.of(), null, null, now, null, null, now);
    }
}
