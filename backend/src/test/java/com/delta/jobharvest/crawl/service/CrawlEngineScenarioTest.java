package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.block.BlockClassifier;
import com.delta.jobharvest.crawl.extract.DetailLinkExtractor;
import com.delta.jobharvest.crawl.extract.JsonLdJobPostingReader;
import com.delta.jobharvest.crawl.extract.RecordExtractionPipeline;
import com.delta.jobharvest.crawl.http.PageTransport;
import com.delta.jobharvest.crawl.identity.DeviceProfileCatalog;
import com.delta.jobharvest.crawl.identity.Identity;
import com.delta.jobharvest.crawl.identity.IdentityLease;
import com.delta.jobharvest.crawl.identity.IdentityPool;
import com.delta.jobharvest.crawl.identity.OutcomeSeverity;
import com.delta.jobharvest.crawl.model.Classification;
import com.delta.jobharvest.crawl.model.CrawlRunSummary;
import com.delta.jobharvest.crawl.model.FailedTask;
import com.delta.jobharvest.crawl.model.FetchRequest;
import com.delta.jobharvest.crawl.model.FetchResult;
import com.delta.jobharvest.crawl.model.JobRecord;
import com.delta.jobharvest.crawl.model.ListingSeed;
import com.delta.jobharvest.crawl.retry.RetryBackoffController;
import com.delta.jobharvest.crawl.sink.RecordSink;
import com.delta.jobharvest.crawl.util.ReasonCodeClassifier;
import com.delta.jobharvest.crawl.util.UrlNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlEngineScenarioTest {
    private static final String START_URL = "https://jobs.example.test/search?ukw=java";

    private final HarvestProperties properties = new HarvestProperties();
    private final ScriptedTransport transport = new ScriptedTransport();
    private final CollectingSink sink = new CollectingSink();
    private final Clock clock = Clock.systemUTC();

    @Test
    void singlePageRunStopsAtMaxPages() {
        transport.listing(START_URL, 20);
        transport.detailsFor(20);

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 2, 1, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));
        CrawlRunSummary summary = context.summarize(clock.instant(), "COMPLETED");

        assertThat(summary.pagesVisited()).isEqualTo(1);
        assertThat(summary.itemsSaved()).isEqualTo(20);
        assertThat(sink.records).hasSize(20);
        assertThat(transport.requestsFor("https://jobs.example.test/search?p=2&ukw=java")).isZero();
        assertThat(context.budget().itemsPlanned()).isZero();
        assertThat(context.frontier().isExhausted()).isTrue();
    }

    @Test
    void paginationFollowsUntilMaxPages() {
        transport.listing(START_URL, 2, 1);
        transport.listing("https://jobs.example.test/search?ukw=java&p=2", 2, 3);
        transport.detailsFor(4);

        CrawlRunContext context = context(new CrawlRunSettings(50, 2, 1, 1, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));

        assertThat(context.budget().pagesVisited()).isEqualTo(2);
        assertThat(context.budget().itemsSaved()).isEqualTo(4);
        assertThat(sink.records).extracting(JobRecord::pageNumber).containsOnly(1, 2);
    }

    @Test
    void rateLimitedListingIsRetriedWithFreshIdentities() {
        transport.respond(START_URL, status(429), status(429), status(429));
        transport.listing(START_URL, 2);
        transport.detailsFor(2);

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 1, 5, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));
        CrawlRunSummary summary = context.summarize(clock.instant(), "COMPLETED");

        assertThat(transport.requestsFor(START_URL)).isEqualTo(4);
        assertThat(summary.retriesScheduled()).isEqualTo(3);
        assertThat(summary.identitiesRetired()).isEqualTo(3);
        assertThat(summary.abandonedTasks()).isZero();
        assertThat(summary.itemsSaved()).isEqualTo(2);
        assertThat(transport.distinctUserAgentsFor(START_URL)).isGreaterThan(1);
    }

    @Test
    void rateLimitedDetailIsRetriedUntilItProceeds() {
        transport.listing(START_URL, 1);
        transport.respond(detailUrl(1), status(429), status(429), status(429));
        transport.detail(1, "<html><body><h1>Backend Engineer</h1></body></html>");
        RecordingIdentityPool pool = new RecordingIdentityPool(properties.getIdentity(), clock);

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 1, 5, 20), pool);
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));

        assertThat(transport.requestsFor(detailUrl(1))).isEqualTo(4);
        assertThat(sink.records).singleElement()
            .satisfies(record -> assertThat(record.title()).isEqualTo("Backend Engineer"));
        assertThat(sink.failures).isEmpty();
        assertThat(context.budget().itemsSaved()).isEqualTo(1);
        assertThat(pool.rateLimited).hasSize(3);
        assertThat(pool.rateLimited).allSatisfy(identity -> assertThat(identity.errorScore()).isPositive());
    }

    @Test
    void concurrentWorkersNeverSaveMoreThanMaxItems() {
        transport.listing(START_URL, 20);
        transport.detailsFor(20);

        CrawlRunContext context = context(new CrawlRunSettings(5, 1, 4, 1, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));
        CrawlRunSummary summary = context.summarize(clock.instant(), "COMPLETED");

        assertThat(sink.records).hasSize(5);
        assertThat(summary.itemsSaved()).isEqualTo(5);
        assertThat(summary.detailTasksAccepted()).isEqualTo(5);
        assertThat(summary.enqueueRejected()).isEqualTo(15);
        assertThat(context.stopReason()).isEqualTo("max_items_reached");
    }

    @Test
    void persistentSoftBlockIsAbandonedAndItsSlotReleased() {
        transport.listing(START_URL, 2);
        transport.detail(1, "<html><body><h1>Job 1</h1></body></html>");
        transport.always(detailUrl(2), page("<html><body>Please verify you are human</body></html>"));

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 1, 1, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));

        assertThat(sink.records).hasSize(1);
        assertThat(sink.failures).singleElement().satisfies(failure -> {
            assertThat(failure.url()).isEqualTo(detailUrl(2));
            assertThat(failure.reasonCode()).isEqualTo(ReasonCodeClassifier.SOFT_BLOCK);
            assertThat(failure.lastClassification()).isEqualTo(Classification.SOFT_BLOCK);
            assertThat(failure.attempts()).isEqualTo(2);
        });
        assertThat(context.budget().snapshot().abandonedTasks()).isEqualTo(1);
        assertThat(context.budget().itemsPlanned()).isZero();
    }

    @Test
    void detailWithoutTitleIsRecordedAsExtractionFailure() {
        transport.listing(START_URL, 1);
        transport.always(detailUrl(1), page("<html><body><p>expired posting</p></body></html>"));

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 1, 1, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));

        assertThat(sink.records).isEmpty();
        assertThat(sink.failures).extracting(FailedTask::reasonCode)
            .containsExactly(ReasonCodeClassifier.EXTRACTION_FAILED);
        assertThat(context.budget().snapshot().extractionFailures()).isEqualTo(1);
    }

    @Test
    void sinkFailureDoesNotCountAsSaved() {
        transport.listing(START_URL, 3);
        transport.detailsFor(3);
        sink.failOn(detailUrl(2));

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 1, 1, 20));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));

        assertThat(context.budget().itemsSaved()).isEqualTo(2);
        assertThat(context.budget().itemsPlanned()).isZero();
    }

    @Test
    void stopRequestReleasesQueuedWork() {
        transport.listing(START_URL, 10);
        transport.detailsFor(10);

        CrawlRunContext context = context(new CrawlRunSettings(50, 1, 1, 1, 20));
        sink.onEmit(record -> context.requestStop("stop_requested"));
        engine().execute(context, List.of(ListingSeed.ofStartUrl(START_URL)));
        CrawlRunSummary summary = context.summarize(clock.instant(), "STOPPED");

        assertThat(summary.itemsSaved()).isEqualTo(1);
        assertThat(summary.unprocessedTasks()).isEqualTo(9);
        assertThat(context.budget().itemsPlanned()).isZero();
        assertThat(context.stopReason()).isEqualTo("stop_requested");
    }

    private CrawlEngine engine() {
        ObjectMapper objectMapper = new ObjectMapper();
        SeedUrlBuilder seedUrlBuilder = new SeedUrlBuilder(properties, new SeedCsvReader());
        RecordExtractionPipeline pipeline = new RecordExtractionPipeline(
            new JsonLdJobPostingReader(objectMapper),
            new DetailLinkExtractor(properties),
            properties,
            clock
        );
        CrawlStateMachine stateMachine = new CrawlStateMachine(
            transport,
            new BlockClassifier(properties),
            pipeline,
            seedUrlBuilder,
            clock
        );
        return new CrawlEngine(stateMachine, seedUrlBuilder);
    }

    private CrawlRunContext context(CrawlRunSettings settings) {
        return context(settings, new IdentityPool(properties.getIdentity(), new DeviceProfileCatalog(), clock));
    }

    private CrawlRunContext context(CrawlRunSettings settings, IdentityPool identityPool) {
        return new CrawlRunContext(
            1L,
            clock.instant(),
            settings,
            identityPool,
            new RetryBackoffController(settings.maxAttempts(), 1, 5, () -> 1.0),
            sink
        );
    }

    private static String detailUrl(int n) {
        return "https://jobs.example.test/desc/" + n;
    }

    private static FetchResult page(String body) {
        return FetchResult.ok(null, 200, body, Map.of());
    }

    private static FetchResult status(int code) {
        return FetchResult.ok(null, code, "", Map.of());
    }

    /**
     * Serves scripted responses by normalized URL. Responses queued with {@link #respond} are
     * used once each, in order; the {@link #always} response is served after that.
     */
    private static final class ScriptedTransport implements PageTransport {
        private final Map<String, Deque<FetchResult>> scripted = new ConcurrentHashMap<>();
        private final Map<String, FetchResult> fallback = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
        private final Map<String, List<String>> userAgents = new ConcurrentHashMap<>();

        void respond(String url, FetchResult... results) {
            Deque<FetchResult> queue = scripted.computeIfAbsent(UrlNormalizer.normalize(url), ignored -> new ArrayDeque<>());
            synchronized (queue) {
                Collections.addAll(queue, results);
            }
        }

        void always(String url, FetchResult result) {
            fallback.put(UrlNormalizer.normalize(url), result);
        }

        void listing(String url, int links) {
            listing(url, links, 1);
        }

        void listing(String url, int links, int firstId) {
            StringBuilder html = new StringBuilder("<html><body><ul>");
            for (int i = firstId; i < firstId + links; i++) {
                html.append("<li><a href=\"/desc/").append(i).append("\">Job ").append(i).append("</a></li>");
            }
            html.append("</ul><a href=\"/about\">About</a></body></html>");
            always(url, page(html.toString()));
        }

        void detail(int id, String html) {
            always(detailUrl(id), page(html));
        }

        void detailsFor(int count) {
            for (int i = 1; i <= count; i++) {
                detail(i, "<html><body><h1>Job " + i + "</h1><div class=\"company-name\">Acme</div></body></html>");
            }
        }

        int requestsFor(String url) {
            AtomicInteger count = counts.get(UrlNormalizer.normalize(url));
            return count == null ? 0 : count.get();
        }

        long distinctUserAgentsFor(String url) {
            return userAgents.getOrDefault(UrlNormalizer.normalize(url), List.of()).stream().distinct().count();
        }

        @Override
        public FetchResult fetch(FetchRequest request) {
            String key = UrlNormalizer.normalize(request.url());
            counts.computeIfAbsent(key, ignored -> new AtomicInteger()).incrementAndGet();
            userAgents.computeIfAbsent(key, ignored -> Collections.synchronizedList(new ArrayList<>()))
                .add(request.headers().get("User-Agent"));
            FetchResult template = null;
            Deque<FetchResult> queue = scripted.get(key);
            if (queue != null) {
                synchronized (queue) {
                    template = queue.pollFirst();
                }
            }
            if (template == null) {
                template = fallback.get(key);
            }
            if (template == null) {
                return new FetchResult(request.url(), request.url(), 404, "", Map.of(), Duration.ZERO, null, null);
            }
            return new FetchResult(
                request.url(),
                request.url(),
                template.statusCode(),
                template.body(),
                template.headers(),
                Duration.ZERO,
                template.transportError(),
                template.transportErrorMessage()
            );
        }
    }

    /**
     * Remembers every identity that was charged with a failed fetch.
     */
    private static final class RecordingIdentityPool extends IdentityPool {
        private final List<Identity> rateLimited = Collections.synchronizedList(new ArrayList<>());

        RecordingIdentityPool(HarvestProperties.Identity settings, Clock clock) {
            super(settings, new DeviceProfileCatalog(), clock);
        }

        @Override
        public void recordOutcome(IdentityLease lease, boolean success, OutcomeSeverity severity) {
            super.recordOutcome(lease, success, severity);
            if (severity == OutcomeSeverity.HARD_BLOCK) {
                rateLimited.add(lease.identity());
            }
        }
    }

    private static final class CollectingSink implements RecordSink {
        private final List<JobRecord> records = Collections.synchronizedList(new ArrayList<>());
        private final List<FailedTask> failures = Collections.synchronizedList(new ArrayList<>());
        private volatile String failingUrl;
        private volatile Consumer<JobRecord> onEmit = record -> { };

        void failOn(String url) {
            this.failingUrl = url;
        }

        void onEmit(Consumer<JobRecord> callback) {
            this.onEmit = callback;
        }

        @Override
        public void emit(JobRecord record) {
            if (record.sourceUrl().equals(failingUrl)) {
                throw new IllegalStateException("sink unavailable");
            }
            records.add(record);
            onEmit.accept(record);
        }

        @Override
        public void recordFailure(FailedTask failedTask) {
            failures.add(failedTask);
        }
    }
}
