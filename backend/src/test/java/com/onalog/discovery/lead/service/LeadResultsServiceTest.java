package com.onalog.discovery.lead.service;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.collab.BillingClient;
import com.onalog.discovery.lead.model.LeadQuery;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.model.SearchResultsResponse;
import com.onalog.discovery.lead.persistence.LeadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LeadResultsServiceTest {
    private final SearchJobService searchJobService = Mockito.mock(SearchJobService.class);
    private final LeadRepository leadRepository = Mockito.mock(LeadRepository.class);
    private final BillingClient billingClient = Mockito.mock(BillingClient.class);
    private LeadResultsService service;

    @BeforeEach
    void setUp() {
        service = new LeadResultsService(searchJobService, leadRepository, billingClient, new DiscoveryProperties());
        when(searchJobService.get("tenant-a", 1L)).thenReturn(job());
        when(leadRepository.countResults(anyLong(), any())).thenReturn(25L);
        when(leadRepository.findResults(anyLong(), any())).thenReturn(List.of());
    }

    @Test
    void tenantWithoutBalanceSeesPreviewOnly() {
        when(billingClient.balance("tenant-a")).thenReturn(0L);

        SearchResultsResponse response = service.results("tenant-a", 1L, 0, 50, null, null, null);

        ArgumentCaptor<LeadQuery> query = ArgumentCaptor.forClass(LeadQuery.class);
        verify(leadRepository).findResults(eq(1L), query.capture());
        assertEquals(10, query.getValue().limit());
        assertEquals(0, query.getValue().offset());
        assertTrue(response.previewLimited());
        assertEquals(25L, response.totalLeads());
    }

    @Test
    void previewPagesPastCapAreEmpty() {
        when(billingClient.balance("tenant-a")).thenReturn(0L);

        SearchResultsResponse response = service.results("tenant-a", 1L, 1, 10, null, null, null);

        assertTrue(response.leads().isEmpty());
        verify(leadRepository, never()).findResults(anyLong(), any());
    }

    @Test
    void payingTenantGetsFullPages() {
        when(billingClient.balance("tenant-a")).thenReturn(40L);

        SearchResultsResponse response = service.results("tenant-a", 1L, 2, 500, 3, "ke", "retail");

        ArgumentCaptor<LeadQuery> query = ArgumentCaptor.forClass(LeadQuery.class);
        verify(leadRepository).findResults(eq(1L), query.capture());
        assertEquals(200, query.getValue().limit());
        assertEquals(400, query.getValue().offset());
        assertEquals(3, query.getValue().minScore());
        assertEquals("retail", query.getValue().industry());
        assertFalse(response.previewLimited());
        assertEquals(200, response.size());
    }

    @Test
    void billingFailureServesPreview() {
        when(billingClient.balance("tenant-a")).thenThrow(new IllegalStateException("billing down"));

        SearchResultsResponse response = service.results("tenant-a", 1L, null, null, null, null, null);

        assertTrue(response.previewLimited());
        assertEquals(0, response.page());
        assertEquals(50, response.size());
    }

    private static SearchJob job() {
        Instant now = Instant.now();
        return new SearchJob(1L, "tenant-a", "shops", "ke", null, null, 50, 0, SearchJobStatus.COMPLETED,
            25, 25, 0, Map.of(), null, null, now, now, now, now);
    }
}
