package com.onalog.discovery.lead.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SearchControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void submitRejectsUnsupportedResultCount() throws Exception {
        mockMvc.perform(post("/api/searches")
                .header(SearchController.TENANT_HEADER, "tenant-api")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"cafes in Nairobi\",\"resultCount\":30}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"));
    }

    @Test
    void submitRejectsFieldsLongerThanTheirColumns() throws Exception {
        mockMvc.perform(post("/api/searches")
                .header(SearchController.TENANT_HEADER, "tenant-api")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hotels\",\"resultCount\":50,\"country\":\"united-states-of-america\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"))
            .andExpect(jsonPath("$.message").value("country must be at most 16 characters"));

        mockMvc.perform(post("/api/searches")
                .header(SearchController.TENANT_HEADER, "t".repeat(129))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hotels\",\"resultCount\":50}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"));

        mockMvc.perform(post("/api/searches")
                .header(SearchController.TENANT_HEADER, "tenant-api")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hotels\",\"resultCount\":50,\"location\":\"" + "n".repeat(201) + "\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void templateRejectsOverlongName() throws Exception {
        long id = submit("tenant-template", "bakeries");

        mockMvc.perform(post("/api/searches/" + id + "/template")
                .header(SearchController.TENANT_HEADER, "tenant-template")
                .param("name", "b".repeat(201)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_search_request"));
    }

    @Test
    void submitThenReadJobAndResults() throws Exception {
        long id = submit("tenant-api", "cafes in Nairobi");

        mockMvc.perform(get("/api/searches/" + id).header(SearchController.TENANT_HEADER, "tenant-api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queryText").value("cafes in Nairobi"))
            .andExpect(jsonPath("$.countryFilter").value("ke"))
            .andExpect(jsonPath("$.resultTarget").value(50));

        mockMvc.perform(get("/api/searches/" + id + "/results").header(SearchController.TENANT_HEADER, "tenant-api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.leads.length()").value(0))
            .andExpect(jsonPath("$.totalLeads").value(0))
            .andExpect(jsonPath("$.previewLimited").value(false));

        mockMvc.perform(get("/api/searches").header(SearchController.TENANT_HEADER, "tenant-api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void otherTenantCannotSeeJob() throws Exception {
        long id = submit("tenant-owner", "plumbers");

        mockMvc.perform(get("/api/searches/" + id).header(SearchController.TENANT_HEADER, "tenant-intruder"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("search_job_not_found"));
        mockMvc.perform(delete("/api/searches/" + id).header(SearchController.TENANT_HEADER, "tenant-intruder"))
            .andExpect(status().isNotFound());
    }

    @Test
    void deleteRemovesJobFromQueue() throws Exception {
        long id = submit("tenant-delete", "bakeries");

        mockMvc.perform(delete("/api/searches/" + id).header(SearchController.TENANT_HEADER, "tenant-delete"))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/searches/" + id).header(SearchController.TENANT_HEADER, "tenant-delete"))
            .andExpect(status().isNotFound());
    }

    @Test
    void templateSavedFromJob() throws Exception {
        long id = submit("tenant-template", "florists");

        mockMvc.perform(post("/api/searches/" + id + "/template")
                .header(SearchController.TENANT_HEADER, "tenant-template")
                .param("name", "Florist sweep"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("Florist sweep"))
            .andExpect(jsonPath("$.queryText").value("florists"));

        mockMvc.perform(get("/api/searches/templates").header(SearchController.TENANT_HEADER, "tenant-template"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("Florist sweep"));
    }

    @Test
    void queueSnapshotIsExposed() throws Exception {
        mockMvc.perform(get("/api/searches/queue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processing").value(false))
            .andExpect(jsonPath("$.queuedJobs").value(greaterThanOrEqualTo(0)));
    }

    private long submit(String tenant, String query) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/searches")
                .header(SearchController.TENANT_HEADER, tenant)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"" + query + "\",\"country\":\"KE\",\"resultCount\":50}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.priority").value(0))
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("searchJobId").asLong();
    }
}
