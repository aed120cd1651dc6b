package com.tapas.smartsales.etl.service;

import com.tapas.smartsales.etl.loader.LoadReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Defines the schema and loads the configured sources once at boot when
 * {@code etl.load-on-startup} is set.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "etl.load-on-startup", havingValue = "true")
public class EtlStartupRunner implements ApplicationRunner {

    private final EtlPipelineService pipelineService;

    public EtlStartupRunner(EtlPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(ApplicationArguments args) {
        pipelineService.defineSchema(false);
        LoadReport report = pipelineService.load();
        log.info("Startup load finished: {} accepted, {} rejected", report.totalAccepted(), report.totalRejected());
        report.rejections().forEach(rejection -> log.warn("Rejected {}", rejection));
    }
}
