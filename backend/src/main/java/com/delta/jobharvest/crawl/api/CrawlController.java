package com.delta.jobharvest.crawl.api;

import com.delta.jobharvest.crawl.model.CrawlRunRequest;
import com.delta.jobharvest.crawl.model.CrawlRunStatusResponse;
import com.delta.jobharvest.crawl.model.CrawlRunSummary;
import com.delta.jobharvest.crawl.model.JobRecordView;
import com.delta.jobharvest.crawl.model.StatusResponse;
import com.delta.jobharvest.crawl.service.CrawlOrchestratorService;
import com.delta.jobharvest.crawl.service.CrawlStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.CONFLICT;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final CrawlStatusService crawlStatusService;

    public CrawlController(CrawlOrchestratorService crawlOrchestratorService, CrawlStatusService crawlStatusService) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.crawlStatusService = crawlStatusService;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        return crawlOrchestratorService.run(toRunRequest(request));
    }

    @PostMapping("/crawl/start")
    public Map<String, Object> startCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        long crawlRunId = crawlOrchestratorService.startAsync(toRunRequest(request));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("crawlRunId", crawlRunId);
        response.put("status", "RUNNING");
        return response;
    }

    @PostMapping("/crawl/{crawlRunId}/stop")
    public Map<String, Object> stopCrawl(@PathVariable long crawlRunId) {
        crawlStatusService.getRun(crawlRunId);
        if (!crawlOrchestratorService.stop(crawlRunId)) {
            throw new ResponseStatusException(CONFLICT, "Crawl run " + crawlRunId + " is not active");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("crawlRunId", crawlRunId);
        response.put("stopRequested", true);
        return response;
    }

    @GetMapping("/crawl/{crawlRunId}")
    public CrawlRunStatusResponse getCrawlRun(@PathVariable long crawlRunId) {
        return crawlStatusService.getRun(crawlRunId);
    }

    @GetMapping("/crawl/{crawlRunId}/failures")
    public Map<String, Long> getCrawlRunFailures(@PathVariable long crawlRunId) {
        return crawlStatusService.getFailureCounts(crawlRunId);
    }

    @GetMapping("/records")
    public List<JobRecordView> getRecords(
        @RequestParam(name = "runId", required = false) Long runId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return crawlStatusService.getRecords(runId, limit);
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return crawlStatusService.getStatus();
    }

    private CrawlRunRequest toRunRequest(CrawlApiRunRequest request) {
        return request == null ? CrawlRunRequest.defaults() : request.toRunRequest();
    }
}
