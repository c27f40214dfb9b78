package com.onalog.discovery.lead.persistence;

import com.onalog.discovery.lead.model.NewSearchJob;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.model.SearchTemplate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SearchJobRepositoryTest {

    @Autowired
    private SearchJobRepository repository;

    @Test
    void insertedJobStartsPending() {
        long id = repository.insert(new NewSearchJob("tenant-a", "coffee shops", "ke", "Nairobi", null, 50, 10));

        SearchJob job = repository.findById(id);

        assertNotNull(job);
        assertEquals(SearchJobStatus.PENDING, job.status());
        assertEquals("tenant-a", job.tenantOwner());
        assertEquals(10, job.priority());
        assertEquals(Map.of(), job.providerTelemetry());
        assertNull(job.startedAt());
        assertTrue(repository.exists(id));
    }

    @Test
    void statusNeverMovesBackward() {
        long id = repository.insert(new NewSearchJob("tenant-a", "bakeries", null, null, null, 50, 0));

        repository.markStarted(id);
        assertTrue(repository.updateStatus(id, SearchJobStatus.EXTRACTING));
        assertFalse(repository.updateStatus(id, SearchJobStatus.QUEUED));
        assertTrue(repository.updateStatus(id, SearchJobStatus.PROCESSING_BACKFILL));
        assertFalse(repository.updateStatus(id, SearchJobStatus.ENRICHING));

        SearchJob job = repository.findById(id);
        assertEquals(SearchJobStatus.PROCESSING_BACKFILL, job.status());
        assertNotNull(job.startedAt());
    }

    @Test
    void completedJobCannotFail() {
        long id = repository.insert(new NewSearchJob("tenant-a", "florists", null, null, null, 100, 0));
        repository.markStarted(id);
        repository.markCompleted(id);

        repository.markFailed(id, "late failure");

        SearchJob job = repository.findById(id);
        assertEquals(SearchJobStatus.COMPLETED, job.status());
        assertNotNull(job.completedAt());
    }

    @Test
    void failedJobKeepsMessage() {
        long id = repository.insert(new NewSearchJob("tenant-a", "plumbers", null, null, null, 200, 0));
        repository.markStarted(id);

        repository.markFailed(id, "x".repeat(1500));
        repository.markCompleted(id);

        SearchJob job = repository.findById(id);
        assertEquals(SearchJobStatus.FAILED, job.status());
        assertEquals(1000, job.errorMessage().length());
        assertNull(job.completedAt());
    }

    @Test
    void searchOutcomeStoresTelemetryAndShortfall() {
        long id = repository.insert(new NewSearchJob("tenant-a", "dentists", "ke", null, null, 50, 0));

        repository.recordSearchOutcome(id, 22, Map.of("overpass", 12, "bing", 10), "found 22 of 50 requested results");

        SearchJob job = repository.findById(id);
        assertEquals(22, job.totalResults());
        assertEquals(12, job.providerTelemetry().get("overpass"));
        assertEquals("found 22 of 50 requested results", job.shortfallReason());
    }

    @Test
    void tenantListingIsNewestFirstAndScoped() {
        long older = repository.insert(new NewSearchJob("tenant-list", "first", null, null, null, 50, 0));
        long newer = repository.insert(new NewSearchJob("tenant-list", "second", null, null, null, 50, 0));
        repository.insert(new NewSearchJob("tenant-other", "third", null, null, null, 50, 0));

        List<SearchJob> jobs = repository.findByTenant("tenant-list", 10);

        assertEquals(List.of(newer, older), jobs.stream().map(SearchJob::id).toList());
        assertEquals(1, repository.findByTenant("tenant-list", 1).size());
    }

    @Test
    void templatesCopySearchParameters() {
        long id = repository.insert(new NewSearchJob("tenant-t", "gyms", "ng", "Lagos", "fitness", 100, 0));
        SearchJob job = repository.findById(id);

        long templateId = repository.insertTemplate("tenant-t", "Lagos gyms", job);

        List<SearchTemplate> templates = repository.findTemplates("tenant-t");
        assertEquals(1, templates.size());
        SearchTemplate template = templates.get(0);
        assertEquals(templateId, template.id());
        assertEquals("Lagos gyms", template.name());
        assertEquals("gyms", template.queryText());
        assertEquals("ng", template.countryFilter());
        assertEquals(100, template.resultTarget());
        assertTrue(repository.findTemplates("tenant-x").isEmpty());
    }

    @Test
    void deleteRemovesJob() {
        long id = repository.insert(new NewSearchJob("tenant-a", "tailors", null, null, null, 50, 0));

        assertEquals(1, repository.delete(id));
        assertFalse(repository.exists(id));
        assertNull(repository.findById(id));
        assertEquals(0, repository.extractedCount(id));
    }
}
