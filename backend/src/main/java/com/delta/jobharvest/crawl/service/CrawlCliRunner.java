package com.delta.jobharvest.crawl.service;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.CrawlRunRequest;
import com.delta.jobharvest.crawl.model.CrawlRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final HarvestProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        HarvestProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CrawlRunSummary summary = crawlOrchestratorService.run(CrawlRunRequest.defaults());
        log.info(
            "Crawl run {} completed with status {}: saved={} pages={} detailsAccepted={} rejected={} abandoned={} unprocessed={}",
            summary.crawlRunId(),
            summary.status(),
            summary.itemsSaved(),
            summary.pagesVisited(),
            summary.detailTasksAccepted(),
            summary.enqueueRejected(),
            summary.abandonedTasks(),
            summary.unprocessedTasks()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.itemsSaved() > 0 ? 0 : 2);
            System.exit(exitCode);
        }
    }
}
