package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.identity.DeviceProfileCatalog;
import com.delta.jobharvest.crawl.identity.IdentityPool;
import com.delta.jobharvest.crawl.model.CrawlRunProgress;
import com.delta.jobharvest.crawl.model.CrawlRunRequest;
import com.delta.jobharvest.crawl.model.CrawlRunSummary;
import com.delta.jobharvest.crawl.model.ListingSeed;
import com.delta.jobharvest.crawl.persistence.HarvestJdbcRepository;
import com.delta.jobharvest.crawl.retry.RetryBackoffController;
import com.delta.jobharvest.crawl.sink.RecordSink;
import com.delta.jobharvest.crawl.sink.RecordSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Run lifecycle around {@link CrawlEngine}: one active run at a time, the {@code crawl_runs} row,
 * periodic progress updates and the final summary.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    static final String STATUS_RUNNING = "RUNNING";
    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    static final String STATUS_NO_RECORDS = "NO_RECORDS";
    static final String STATUS_STOPPED = "STOPPED";
    static final String STATUS_FAILED = "FAILED";
    static final String STOP_REQUESTED = "stop_requested";

    private final HarvestJdbcRepository repository;
    private final CrawlEngine engine;
    private final SeedUrlBuilder seedUrlBuilder;
    private final RecordSinkFactory sinkFactory;
    private final DeviceProfileCatalog deviceProfileCatalog;
    private final HarvestProperties properties;
    private final ExecutorService crawlRunExecutor;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    private volatile CrawlRunContext activeRun;

    public CrawlOrchestratorService(
        HarvestJdbcRepository repository,
        CrawlEngine engine,
        SeedUrlBuilder seedUrlBuilder,
        RecordSinkFactory sinkFactory,
        DeviceProfileCatalog deviceProfileCatalog,
        HarvestProperties properties,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        Clock clock
    ) {
        this.repository = repository;
        this.engine = engine;
        this.seedUrlBuilder = seedUrlBuilder;
        this.sinkFactory = sinkFactory;
        this.deviceProfileCatalog = deviceProfileCatalog;
        this.properties = properties;
        this.crawlRunExecutor = crawlRunExecutor;
        this.clock = clock;
    }

    public CrawlRunSummary run(CrawlRunRequest request) {
        List<ListingSeed> seeds = seedUrlBuilder.resolveSeeds(request);
        CrawlRunContext context = begin(request, seeds);
        return execute(context, seeds);
    }

    public long startAsync(CrawlRunRequest request) {
        List<ListingSeed> seeds = seedUrlBuilder.resolveSeeds(request);
        CrawlRunContext context = begin(request, seeds);
        try {
            crawlRunExecutor.submit(() -> execute(context, seeds));
        } catch (RuntimeException e) {
            finish(context, STATUS_FAILED, "exception=" + e.getClass().getSimpleName());
            throw e;
        }
        return context.crawlRunId();
    }

    /**
     * Asks the active run to stop. Returns false if {@code crawlRunId} is not the active run.
     */
    public boolean stop(long crawlRunId) {
        CrawlRunContext context = activeRun;
        if (context == null || context.crawlRunId() != crawlRunId) {
            return false;
        }
        context.requestStop(STOP_REQUESTED);
        return true;
    }

    public Optional<CrawlRunProgress> liveProgress(long crawlRunId) {
        CrawlRunContext context = activeRun;
        if (context == null || context.crawlRunId() != crawlRunId) {
            return Optional.empty();
        }
        return Optional.of(context.budget().snapshot());
    }

    public Optional<Long> activeRunId() {
        CrawlRunContext context = activeRun;
        return context == null ? Optional.empty() : Optional.of(context.crawlRunId());
    }

    private CrawlRunContext begin(CrawlRunRequest request, List<ListingSeed> seeds) {
        synchronized (lifecycleLock) {
            CrawlRunContext current = activeRun;
            if (current != null) {
                throw new ActiveCrawlRunException(current.crawlRunId(), current.startedAt());
            }
            CrawlRunSettings settings = CrawlRunSettings.resolve(request, properties);
            Instant startedAt = clock.instant();
            String seedLabel = seeds.stream().map(ListingSeed::label).collect(Collectors.joining(" | "));
            long crawlRunId = repository.insertCrawlRun(startedAt, STATUS_RUNNING, seedLabel);
            RecordSink sink;
            try {
                sink = sinkFactory.openSink(crawlRunId);
            } catch (RuntimeException e) {
                repository.completeCrawlRun(crawlRunId, clock.instant(), STATUS_FAILED, "sink_unavailable", null);
                throw e;
            }
            CrawlRunContext context = new CrawlRunContext(
                crawlRunId,
                startedAt,
                settings,
                new IdentityPool(properties.getIdentity(), deviceProfileCatalog, clock),
                new RetryBackoffController(settings.maxAttempts(), properties.getBackoff()),
                sink
            );
            activeRun = context;
            log.info(
                "Crawl run {} started: seeds=[{}] maxItems={} maxPages={} concurrency={} maxAttempts={}",
                crawlRunId,
                seedLabel,
                settings.maxItems() <= 0 ? "unlimited" : settings.maxItems(),
                settings.maxPages(),
                settings.maxConcurrency(),
                settings.maxAttempts()
            );
            return context;
        }
    }

    private CrawlRunSummary execute(CrawlRunContext context, List<ListingSeed> seeds) {
        long crawlRunId = context.crawlRunId();
        String status = STATUS_FAILED;
        String notes = "crawl_failed";
        ScheduledExecutorService progress = Executors.newSingleThreadScheduledExecutor();
        progress.scheduleAtFixedRate(
            () -> {
                try {
                    repository.updateCrawlRunProgress(crawlRunId, context.budget().snapshot(), clock.instant());
                } catch (Exception e) {
                    log.debug("Progress update failed for crawl run {}", crawlRunId, e);
                }
            },
            properties.getProgressIntervalSeconds(),
            properties.getProgressIntervalSeconds(),
            TimeUnit.SECONDS
        );
        try {
            engine.execute(context, seeds);
            status = determineStatus(context);
            notes = buildNotes(context);
        } catch (Exception e) {
            log.warn("Crawl run {} failed", crawlRunId, e);
            status = STATUS_FAILED;
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            progress.shutdownNow();
        }
        return finish(context, status, notes);
    }

    private CrawlRunSummary finish(CrawlRunContext context, String status, String notes) {
        Instant finishedAt = clock.instant();
        try {
            context.sink().close();
        } catch (RuntimeException e) {
            log.warn("Failed to close sink of crawl run {}", context.crawlRunId(), e);
        }
        try {
            repository.completeCrawlRun(context.crawlRunId(), finishedAt, status, notes, context.budget().snapshot());
        } catch (Exception e) {
            log.warn("Failed to record completion of crawl run {}", context.crawlRunId(), e);
        } finally {
            synchronized (lifecycleLock) {
                if (activeRun == context) {
                    activeRun = null;
                }
            }
        }
        CrawlRunSummary summary = context.summarize(finishedAt, status);
        log.info(
            "Crawl run {} finished with status {}: saved={} pages={} abandoned={} extractionFailures={} retries={} identitiesRetired={}",
            summary.crawlRunId(),
            summary.status(),
            summary.itemsSaved(),
            summary.pagesVisited(),
            summary.abandonedTasks(),
            summary.extractionFailures(),
            summary.retriesScheduled(),
            summary.identitiesRetired()
        );
        return summary;
    }

    static String determineStatus(CrawlRunContext context) {
        if (STOP_REQUESTED.equals(context.stopReason())) {
            return STATUS_STOPPED;
        }
        if (context.budget().itemsSaved() == 0) {
            return STATUS_NO_RECORDS;
        }
        CrawlRunProgress snapshot = context.budget().snapshot();
        if (snapshot.abandonedTasks() > 0 || snapshot.extractionFailures() > 0) {
            return STATUS_COMPLETED_WITH_ERRORS;
        }
        return STATUS_COMPLETED;
    }

    private String buildNotes(CrawlRunContext context) {
        String reason = context.stopReason() == null ? "frontier_exhausted" : context.stopReason();
        return "reason=" + reason
            + " saved=" + context.budget().itemsSaved()
            + " rejected=" + context.enqueueRejected()
            + " retries=" + context.retriesScheduled()
            + " unprocessed=" + context.unprocessedTasks();
    }
}
