package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.frontier.Frontier;
import com.delta.jobharvest.crawl.model.CrawlTask;
import com.delta.jobharvest.crawl.model.ListingSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drives one run: seeds the frontier, runs a fixed pool of workers until the frontier is
 * exhausted or the run is stopped, then releases whatever work is left.
 */
@Component
public class CrawlEngine {
    private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

    private final CrawlStateMachine stateMachine;
    private final SeedUrlBuilder seedUrlBuilder;

    public CrawlEngine(CrawlStateMachine stateMachine, SeedUrlBuilder seedUrlBuilder) {
        this.stateMachine = stateMachine;
        this.seedUrlBuilder = seedUrlBuilder;
    }

    public void execute(CrawlRunContext context, List<ListingSeed> seeds) {
        Frontier frontier = context.frontier();
        for (ListingSeed seed : seeds) {
            String url = seedUrlBuilder.pageUrl(seed, 1);
            if (!frontier.enqueue(CrawlTask.listing(url, seed, 1, null, "seed:" + seed.label()))) {
                log.warn("Seed {} was not admitted", url);
            }
        }

        int workerCount = context.settings().maxConcurrency();
        long runId = context.crawlRunId();
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-run-" + runId + "-worker");
            thread.setDaemon(true);
            return thread;
        });
        try {
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                workers.submit(() -> workerLoop(context, workerIndex));
            }
            workers.shutdown();
            while (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Crawl run {} progress {}", runId, context.budget().snapshot());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.requestStop("interrupted");
            workers.shutdownNow();
        } finally {
            windDown(context);
        }
    }

    private void workerLoop(CrawlRunContext context, int workerIndex) {
        Thread.currentThread().setName("crawl-run-" + context.crawlRunId() + "-worker-" + workerIndex);
        Frontier frontier = context.frontier();
        int pollIntervalMs = context.settings().pollIntervalMs();
        while (!context.isStopRequested() && !Thread.currentThread().isInterrupted()) {
            CrawlTask task;
            try {
                task = frontier.dequeue(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null) {
                if (frontier.isExhausted() || frontier.isClosed()) {
                    return;
                }
                continue;
            }
            stateMachine.process(task, context);
            if (context.completionPolicy().isComplete()) {
                context.requestStop("max_items_reached");
            }
        }
    }

    private void windDown(CrawlRunContext context) {
        context.frontier().close();
        List<CrawlTask> leftovers = new ArrayList<>();
        for (String url : new ArrayList<>(context.pendingRetries().keySet())) {
            CrawlTask pending = context.pendingRetries().remove(url);
            if (pending != null) {
                context.frontier().cancelRetry(pending);
                leftovers.add(pending);
            }
        }
        context.shutdownScheduler();
        leftovers.addAll(context.frontier().drainQueued());
        for (CrawlTask task : leftovers) {
            stateMachine.dropUnprocessed(task, context);
        }
        if (!leftovers.isEmpty()) {
            log.info("Crawl run {} left {} task(s) unprocessed", context.crawlRunId(), leftovers.size());
        }
    }
}
