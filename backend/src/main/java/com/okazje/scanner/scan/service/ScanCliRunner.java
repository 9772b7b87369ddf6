package com.okazje.scanner.scan.service;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.ScanSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScanCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScanCliRunner.class);

    private final ScannerProperties properties;
    private final ScanOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ScanCliRunner(
        ScannerProperties properties,
        ScanOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ScanSummary summary = orchestratorService.runScan(properties.getScan().getDestination());
        log.info("Scan completed with status {}: {} new listings over {} keywords, {} failures",
            summary.status(), summary.acceptedCount(), summary.keywordCount(), summary.failureCount());
        for (Listing listing : summary.reported()) {
            log.info("Reported {} [{}] {} zł {}", listing.id(), listing.platform().label(),
                listing.price().toPlainString(), listing.url());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
