package com.delta.jobharvest.crawl;

import com.delta.jobharvest.crawl.http.PageTransport;
import com.delta.jobharvest.crawl.model.FetchRequest;
import com.delta.jobharvest.crawl.model.FetchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.Map;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PageTransport pageTransport;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        when(pageTransport.fetch(any(FetchRequest.class))).thenAnswer(invocation -> {
            FetchRequest request = invocation.getArgument(0);
            String url = request.url();
            if (url.contains("/search")) {
                return FetchResult.ok(url, 200, """
                    <html><body>
                      <a href="/desc/1">one</a><a href="/desc/2">two</a>
                      <a href="/desc/3">three</a><a href="/desc/4">four</a>
                    </body></html>
                    """, Map.of());
            }
            String id = url.substring(url.lastIndexOf('/') + 1);
            return FetchResult.ok(url, 200, """
                <html><head><script type="application/ld+json">
                {"@type":"JobPosting","title":"Engineer %s","hiringOrganization":{"name":"Acme"}}
                </script></head><body><p>Apply now</p></body></html>
                """.formatted(id), Map.of());
        });
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/crawl/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void runWithoutSeedIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/crawl/run"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void runThenInspectRunRecordsAndStatus() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/crawl/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startUrl":"https://jobs.example.test/search?ukw=java","maxItems":3,"maxPages":1}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.itemsSaved").value(3))
            .andExpect(jsonPath("$.pagesVisited").value(1))
            .andReturn();
        JsonNode summary = objectMapper.readTree(result.getResponse().getContentAsString());
        long runId = summary.get("crawlRunId").asLong();

        mockMvc.perform(get("/api/crawl/{id}", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.itemsSaved").value(3))
            .andExpect(jsonPath("$.live").value(false));

        mockMvc.perform(get("/api/records").param("runId", String.valueOf(runId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[0].company").value("Acme"))
            .andExpect(jsonPath("$[0].extractionTier").value("STRUCTURED_DATA"));

        mockMvc.perform(get("/api/crawl/{id}/failures", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());

        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.tableCounts.job_records").value(greaterThanOrEqualTo(3)))
            .andExpect(jsonPath("$.activeCrawlRunId").value(nullValue()))
            .andExpect(jsonPath("$.latestCrawlRun").exists());
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/crawl/{id}", Long.MAX_VALUE))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/crawl/{id}/stop", Long.MAX_VALUE))
            .andExpect(status().isNotFound());
    }
}
