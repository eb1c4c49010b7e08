package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.model.CrawlRunProgress;
import com.delta.jobharvest.crawl.model.CrawlRunStatusResponse;
import com.delta.jobharvest.crawl.model.JobRecordView;
import com.delta.jobharvest.crawl.model.StatusResponse;
import com.delta.jobharvest.crawl.persistence.HarvestJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class CrawlStatusService {
    private static final Logger log = LoggerFactory.getLogger(CrawlStatusService.class);

    private final HarvestJdbcRepository repository;
    private final CrawlOrchestratorService orchestratorService;

    public CrawlStatusService(HarvestJdbcRepository repository, CrawlOrchestratorService orchestratorService) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.debug("Database unreachable", e);
            dbConnected = false;
        }
        Long activeRunId = orchestratorService.activeRunId().orElse(null);
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>(), activeRunId, null);
        }
        Map<String, Long> counts = repository.tableCounts();
        CrawlRunStatusResponse latest = repository.findMostRecentCrawlRun();
        return new StatusResponse(true, counts, activeRunId, latest == null ? null : withLiveProgress(latest));
    }

    /**
     * Stored run state, overlaid with the in-memory counters when the run is still active.
     */
    public CrawlRunStatusResponse getRun(long crawlRunId) {
        CrawlRunStatusResponse stored = repository.findCrawlRun(crawlRunId);
        if (stored == null) {
            throw new ResponseStatusException(NOT_FOUND, "Crawl run not found: " + crawlRunId);
        }
        return withLiveProgress(stored);
    }

    public Map<String, Long> getFailureCounts(long crawlRunId) {
        getRun(crawlRunId);
        return repository.countFailedTasksByReason(crawlRunId);
    }

    public List<JobRecordView> getRecords(Long crawlRunId, Integer limit) {
        int safeLimit = limit == null ? 50 : Math.max(1, Math.min(limit, 500));
        return repository.findRecords(crawlRunId, safeLimit);
    }

    private CrawlRunStatusResponse withLiveProgress(CrawlRunStatusResponse stored) {
        Optional<CrawlRunProgress> live = orchestratorService.liveProgress(stored.crawlRunId());
        if (live.isEmpty()) {
            return stored;
        }
        CrawlRunProgress progress = live.get();
        return new CrawlRunStatusResponse(
            stored.crawlRunId(),
            stored.startedAt(),
            stored.finishedAt(),
            stored.status(),
            stored.notes(),
            progress.itemsSaved(),
            progress.pagesVisited(),
            progress.abandonedTasks(),
            progress.extractionFailures(),
            true
        );
    }
}
