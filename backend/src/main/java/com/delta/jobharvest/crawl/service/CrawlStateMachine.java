package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.block.BlockClassifier;
import com.delta.jobharvest.crawl.extract.RecordExtractionPipeline;
import com.delta.jobharvest.crawl.frontier.CrawlBudget;
import com.delta.jobharvest.crawl.frontier.Frontier;
import com.delta.jobharvest.crawl.http.PageTransport;
import com.delta.jobharvest.crawl.identity.IdentityLease;
import com.delta.jobharvest.crawl.identity.IdentityPool;
import com.delta.jobharvest.crawl.identity.OutcomeSeverity;
import com.delta.jobharvest.crawl.model.Classification;
import com.delta.jobharvest.crawl.model.CrawlTask;
import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.FetchRequest;
import com.delta.jobharvest.crawl.model.FetchResult;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.delta.jobharvest.crawl.retry.BackoffDecision;
import com.delta.jobharvest.crawl.retry.IdentityAction;
import com.delta.jobharvest.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs one task through fetch, classify and handle. Every task ends in exactly one of: resolved
 * after its handler ran, handed to the retry scheduler, or abandoned.
 */
@Component
public class CrawlStateMachine {
    private static final Logger log = LoggerFactory.getLogger(CrawlStateMachine.class);

    private final PageTransport transport;
    private final BlockClassifier blockClassifier;
    private final RecordExtractionPipeline extractionPipeline;
    private final SeedUrlBuilder seedUrlBuilder;
    private final Clock clock;

    public CrawlStateMachine(
        PageTransport transport,
        BlockClassifier blockClassifier,
        RecordExtractionPipeline extractionPipeline,
        SeedUrlBuilder seedUrlBuilder,
        Clock clock
    ) {
        this.transport = transport;
        this.blockClassifier = blockClassifier;
        this.extractionPipeline = extractionPipeline;
        this.seedUrlBuilder = seedUrlBuilder;
        this.clock = clock;
    }

    public void process(CrawlTask task, CrawlRunContext context) {
        try {
            runCycle(task, context);
        } catch (RuntimeException e) {
            log.warn("Handler failed for {} task {}", task.kind(), task.url(), e);
            abandon(
                task,
                context,
                null,
                null,
                ReasonCodeClassifier.HANDLER_EXCEPTION,
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
    }

    private void runCycle(CrawlTask task, CrawlRunContext context) {
        IdentityPool pool = context.identityPool();
        FetchResult result;
        Classification classification;
        BackoffDecision decision;
        try (IdentityLease lease = pool.acquire(task.affinityKey())) {
            FetchRequest request = new FetchRequest(
                task.url(),
                lease.identity().requestHeaders(),
                lease.identity().cookieJar(),
                task.referer()
            );
            result = transport.fetch(request);
            pool.ingestCookies(lease, result.setCookieHeaders());
            classification = blockClassifier.classify(result);
            pool.recordOutcome(lease, classification == Classification.OK, OutcomeSeverity.of(classification));
            decision = context.backoffController().decide(task, classification);
            applyIdentityAction(pool, lease, decision.identityAction(), classification);
        }

        if (decision.isProceed()) {
            if (task.isListing()) {
                handleListing(task, result, context);
            } else {
                handleDetail(task, result, context);
            }
            context.frontier().resolve(task);
            return;
        }
        if (decision.isRetry()) {
            log.debug(
                "{} on {} (attempt {}), retrying in {}ms",
                classification,
                task.url(),
                task.attempt(),
                decision.delay().toMillis()
            );
            scheduleRetry(task, decision, context);
            return;
        }
        abandon(
            task,
            context,
            classification,
            result,
            ReasonCodeClassifier.fromOutcome(classification, result),
            describe(classification, result)
        );
    }

    private void handleListing(CrawlTask task, FetchResult result, CrawlRunContext context) {
        CrawlBudget budget = context.budget();
        Frontier frontier = context.frontier();
        budget.recordPageVisited();
        List<String> links = extractionPipeline.extractLinks(result.body(), result.finalUrlOrRequested());
        int accepted = 0;
        int rejected = 0;
        for (String link : links) {
            if (context.completionPolicy().shouldAdmitMore()
                && frontier.enqueue(CrawlTask.detail(link, task.url(), task.pageNumber()))) {
                accepted++;
            } else {
                rejected++;
            }
        }
        context.recordRejected(rejected);
        log.info(
            "Listing page {} of '{}': links={} accepted={} rejected={}",
            task.pageNumber(),
            task.seed() == null ? task.url() : task.seed().label(),
            links.size(),
            accepted,
            rejected
        );

        int nextPage = task.pageNumber() + 1;
        if (links.isEmpty()) {
            log.info("No detail links on {}; pagination for this seed ends", task.url());
            return;
        }
        if (nextPage > context.settings().maxPages() || task.seed() == null) {
            return;
        }
        if (!context.completionPolicy().shouldAdmitMore()) {
            return;
        }
        String nextUrl = seedUrlBuilder.pageUrl(task.seed(), nextPage);
        boolean enqueued = frontier.enqueue(CrawlTask.listing(nextUrl, task.seed(), nextPage, task.url(), task.affinityKey()));
        if (!enqueued) {
            log.debug("Next listing page {} was not admitted", nextUrl);
        }
    }

    private void handleDetail(CrawlTask task, FetchResult result, CrawlRunContext context) {
        CrawlBudget budget = context.budget();
        Optional<JobRecord> record = extractionPipeline.extractRecord(result.body(), task);
        if (record.isEmpty()) {
            budget.recordExtractionFailure();
            releasePlanned(task, budget, false);
            log.warn("No title extracted from {}; record discarded", task.url());
            recordFailure(context, new FailedTask(
                task.url(),
                task.kind(),
                task.attempt() + 1,
                Classification.OK,
                result.statusCode(),
                ReasonCodeClassifier.EXTRACTION_FAILED,
                "title missing after structured and heuristic extraction",
                clock.instant()
            ));
            return;
        }
        boolean saved;
        try {
            context.sink().emit(record.get());
            saved = true;
        } catch (RuntimeException e) {
            saved = false;
            log.warn("Sink rejected record for {}", task.url(), e);
        }
        releasePlanned(task, budget, saved);
        if (saved) {
            log.info(
                "Saved '{}' ({}) [{}/{}]",
                record.get().title(),
                record.get().extractionTier(),
                budget.itemsSaved(),
                context.settings().maxItems() <= 0 ? "unlimited" : context.settings().maxItems()
            );
        }
    }

    private void scheduleRetry(CrawlTask task, BackoffDecision decision, CrawlRunContext context) {
        Frontier frontier = context.frontier();
        CrawlTask next = task.nextAttempt();
        frontier.awaitRetry(task);
        context.pendingRetries().put(next.url(), next);
        context.recordRetryScheduled();
        try {
            context.retryScheduler().schedule(
                () -> reenter(next, context),
                decision.delay().toMillis(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            if (context.pendingRetries().remove(next.url()) != null) {
                frontier.cancelRetry(next);
                dropUnprocessed(next, context);
            }
        }
    }

    private void reenter(CrawlTask next, CrawlRunContext context) {
        if (context.pendingRetries().remove(next.url()) == null) {
            return;
        }
        if (!context.frontier().requeue(next)) {
            dropUnprocessed(next, context);
        }
    }

    /**
     * Releases a task that never reached a terminal handler because the run stopped first.
     */
    void dropUnprocessed(CrawlTask task, CrawlRunContext context) {
        releasePlanned(task, context.budget(), false);
        context.recordUnprocessed();
    }

    private void abandon(
        CrawlTask task,
        CrawlRunContext context,
        Classification classification,
        FetchResult result,
        String reasonCode,
        String detail
    ) {
        context.budget().recordAbandoned();
        releasePlanned(task, context.budget(), false);
        Integer status = result == null || result.statusCode() <= 0 ? null : result.statusCode();
        log.warn(
            "Abandoning {} task {} after {} attempt(s): {}",
            task.kind(),
            task.url(),
            task.attempt() + 1,
            reasonCode
        );
        recordFailure(context, new FailedTask(
            task.url(),
            task.kind(),
            task.attempt() + 1,
            classification,
            status,
            reasonCode,
            detail,
            clock.instant()
        ));
        context.frontier().resolve(task);
    }

    private void applyIdentityAction(
        IdentityPool pool,
        IdentityLease lease,
        IdentityAction action,
        Classification classification
    ) {
        if (action == IdentityAction.RETIRE) {
            pool.retire(lease, classification.name().toLowerCase(Locale.ROOT));
        } else if (action == IdentityAction.REFRESH_COOKIES) {
            pool.refreshCookies(lease);
        }
    }

    private void releasePlanned(CrawlTask task, CrawlBudget budget, boolean saved) {
        if (task.isDetail() && task.plannedButNotYetCounted()) {
            budget.resolvePlanned(saved);
        }
    }

    private void recordFailure(CrawlRunContext context, FailedTask failedTask) {
        try {
            context.sink().recordFailure(failedTask);
        } catch (RuntimeException e) {
            log.warn("Failed to record failed task {}", failedTask.url(), e);
        }
    }

    private String describe(Classification classification, FetchResult result) {
        if (result == null) {
            return classification == null ? null : classification.name();
        }
        if (result.hasTransportError()) {
            return result.transportError() + ": " + result.transportErrorMessage();
        }
        if (classification == Classification.SOFT_BLOCK) {
            String signal = blockClassifier.matchedSignal(result.body());
            return "block phrase '" + signal + "'";
        }
        return "status " + result.statusCode();
    }
}
