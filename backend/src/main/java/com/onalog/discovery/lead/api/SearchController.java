package com.onalog.discovery.lead.api;

import com.onalog.discovery.lead.model.QueueSnapshot;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchRequest;
import com.onalog.discovery.lead.model.SearchResultsResponse;
import com.onalog.discovery.lead.model.SearchTemplate;
import com.onalog.discovery.lead.model.SubmitSearchResponse;
import com.onalog.discovery.lead.queue.SearchQueueScheduler;
import com.onalog.discovery.lead.service.LeadResultsService;
import com.onalog.discovery.lead.service.SearchJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/searches")
public class SearchController {
    static final String TENANT_HEADER = "X-Tenant-Id";

    private final SearchJobService searchJobService;
    private final LeadResultsService leadResultsService;
    private final SearchQueueScheduler scheduler;

    public SearchController(
        SearchJobService searchJobService,
        LeadResultsService leadResultsService,
        SearchQueueScheduler scheduler
    ) {
        this.searchJobService = searchJobService;
        this.leadResultsService = leadResultsService;
        this.scheduler = scheduler;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmitSearchResponse submit(
        @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
        @RequestBody(required = false) SearchRequest request
    ) {
        return searchJobService.submit(tenantId, request);
    }

    @GetMapping
    public List<SearchJob> list(
        @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return searchJobService.list(tenantId, limit);
    }

    @GetMapping("/queue")
    public QueueSnapshot queue() {
        return scheduler.snapshot();
    }

    @GetMapping("/templates")
    public List<SearchTemplate> templates(@RequestHeader(name = TENANT_HEADER, required = false) String tenantId) {
        return searchJobService.templates(tenantId);
    }

    @GetMapping("/{id}")
    public SearchJob get(
        @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
        @PathVariable("id") long id
    ) {
        return searchJobService.get(tenantId, id);
    }

    @GetMapping("/{id}/results")
    public SearchResultsResponse results(
        @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
        @PathVariable("id") long id,
        @RequestParam(name = "page", required = false) Integer page,
        @RequestParam(name = "size", required = false) Integer size,
        @RequestParam(name = "minScore", required = false) Integer minScore,
        @RequestParam(name = "country", required = false) String country,
        @RequestParam(name = "industry", required = false) String industry
    ) {
        return leadResultsService.results(tenantId, id, page, size, minScore, country, industry);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
        @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
        @PathVariable("id") long id
    ) {
        searchJobService.delete(tenantId, id);
    }

    @PostMapping("/{id}/template")
    @ResponseStatus(HttpStatus.CREATED)
    public SearchTemplate saveTemplate(
        @RequestHeader(name = TENANT_HEADER, required = false) String tenantId,
        @PathVariable("id") long id,
        @RequestParam(name = "name", required = false) String name
    ) {
        return searchJobService.saveTemplate(tenantId, id, name);
    }
}
