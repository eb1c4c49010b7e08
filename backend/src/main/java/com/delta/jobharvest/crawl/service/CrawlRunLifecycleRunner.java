package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.crawl.persistence.HarvestJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Runs live only inside this process, so any row still marked RUNNING at startup belongs to a
 * process that died mid-run.
 */
@Component
@Order(0)
public class CrawlRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlRunLifecycleRunner.class);

    private final HarvestJdbcRepository repository;
    private final Clock clock;

    public CrawlRunLifecycleRunner(HarvestJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping crawl run cleanup because database is unreachable");
            return;
        }
        int aborted = repository.abortRunningCrawlRuns(clock.instant(), "aborted_on_startup");
        if (aborted > 0) {
            log.info("Marked {} orphaned crawl run(s) as ABORTED", aborted);
        }
    }
}
