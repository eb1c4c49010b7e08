package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.frontier.CompletionPolicy;
import com.delta.jobharvest.crawl.frontier.CrawlBudget;
import com.delta.jobharvest.crawl.frontier.Frontier;
import com.delta.jobharvest.crawl.identity.IdentityPool;
import com.delta.jobharvest.crawl.model.CrawlRunSummary;
import com.delta.jobharvest.crawl.model.CrawlTask;
import com.delta.jobharvest.crawl.retry.RetryBackoffController;
import com.delta.jobharvest.crawl.sink.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Everything one crawl run owns: its budget, frontier, identity pool, backoff controller, output
 * sink and retry scheduler. Nothing here is shared between runs.
 */
public class CrawlRunContext {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunContext.class);

    private final long crawlRunId;
    private final Instant startedAt;
    private final CrawlRunSettings settings;
    private final CrawlBudget budget;
    private final CompletionPolicy completionPolicy;
    private final Frontier frontier;
    private final IdentityPool identityPool;
    private final RetryBackoffController backoffController;
    private final RecordSink sink;
    private final ScheduledExecutorService retryScheduler;
    private final Map<String, CrawlTask> pendingRetries = new ConcurrentHashMap<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<String> stopReason = new AtomicReference<>();
    private final AtomicInteger retriesScheduled = new AtomicInteger();
    private final AtomicInteger enqueueRejected = new AtomicInteger();
    private final AtomicInteger unprocessedTasks = new AtomicInteger();

    public CrawlRunContext(
        long crawlRunId,
        Instant startedAt,
        CrawlRunSettings settings,
        IdentityPool identityPool,
        RetryBackoffController backoffController,
        RecordSink sink
    ) {
        this.crawlRunId = crawlRunId;
        this.startedAt = startedAt;
        this.settings = settings;
        this.budget = new CrawlBudget(settings.maxItems());
        this.completionPolicy = new CompletionPolicy(budget);
        this.frontier = new Frontier(budget);
        this.identityPool = identityPool;
        this.backoffController = backoffController;
        this.sink = sink;
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-run-" + crawlRunId + "-retry");
            thread.setDaemon(true);
            return thread;
        });
    }

    public long crawlRunId() {
        return crawlRunId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public CrawlRunSettings settings() {
        return settings;
    }

    public CrawlBudget budget() {
        return budget;
    }

    public CompletionPolicy completionPolicy() {
        return completionPolicy;
    }

    public Frontier frontier() {
        return frontier;
    }

    public IdentityPool identityPool() {
        return identityPool;
    }

    public RetryBackoffController backoffController() {
        return backoffController;
    }

    public RecordSink sink() {
        return sink;
    }

    ScheduledExecutorService retryScheduler() {
        return retryScheduler;
    }

    Map<String, CrawlTask> pendingRetries() {
        return pendingRetries;
    }

    /**
     * Stops admission of new work. In-flight tasks finish; queued and pending tasks are released
     * when the run winds down. Only the first reason is kept.
     */
    public void requestStop(String reason) {
        if (stopRequested.compareAndSet(false, true)) {
            stopReason.set(reason);
            log.info("Crawl run {} stopping: {}", crawlRunId, reason);
        }
        frontier.close();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public String stopReason() {
        return stopReason.get();
    }

    void recordRetryScheduled() {
        retriesScheduled.incrementAndGet();
    }

    void recordRejected(int count) {
        enqueueRejected.addAndGet(count);
    }

    void recordUnprocessed() {
        unprocessedTasks.incrementAndGet();
    }

    public int retriesScheduled() {
        return retriesScheduled.get();
    }

    public int enqueueRejected() {
        return enqueueRejected.get();
    }

    public int unprocessedTasks() {
        return unprocessedTasks.get();
    }

    void shutdownScheduler() {
        List<Runnable> neverRun = retryScheduler.shutdownNow();
        if (!neverRun.isEmpty()) {
            log.debug("Crawl run {} discarded {} scheduled retries", crawlRunId, neverRun.size());
        }
    }

    public CrawlRunSummary summarize(Instant finishedAt, String status) {
        return new CrawlRunSummary(
            crawlRunId,
            startedAt,
            finishedAt,
            status,
            budget.itemsSaved(),
            budget.pagesVisited(),
            frontier.acceptedDetails(),
            enqueueRejected.get(),
            budget.snapshot().extractionFailures(),
            budget.snapshot().abandonedTasks(),
            retriesScheduled.get(),
            identityPool.retiredCount(),
            unprocessedTasks.get()
        );
    }
}
