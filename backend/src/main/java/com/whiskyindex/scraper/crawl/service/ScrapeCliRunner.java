package com.whiskyindex.scraper.crawl.service;

import com.whiskyindex.scraper.config.ScraperProperties;
import com.whiskyindex.scraper.crawl.model.ScrapeRunRequest;
import com.whiskyindex.scraper.crawl.model.ScrapeRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ScraperProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        ScrapeRunSummary summary = orchestratorService.run(toRequest(cli));
        log.info(
            "Scrape run finished status={} startId={} maxId={} finalProcessedId={} found={} notFound={} errors={} persisted={} unpersisted={}",
            summary.status().dbValue(),
            summary.startId(),
            summary.maxId(),
            summary.finalProcessedId(),
            summary.found(),
            summary.notFound(),
            summary.errors(),
            summary.recordsPersisted(),
            summary.recordsDropped()
        );
        if (summary.errorMessage() != null) {
            log.error("Scrape run error: {}", summary.errorMessage());
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode(summary);
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }

    static ScrapeRunRequest toRequest(ScraperProperties.Cli cli) {
        return new ScrapeRunRequest(
            cli.getStartId(),
            cli.getMaxId(),
            cli.isFindMaxId(),
            null,
            null,
            null,
            cli.isDryRun(),
            cli.isResume()
        );
    }

    static int exitCode(ScrapeRunSummary summary) {
        return summary != null && summary.isSuccessful() ? 0 : 1;
    }
}
