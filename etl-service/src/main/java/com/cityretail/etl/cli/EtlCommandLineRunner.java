package com.cityretail.etl.cli;

import com.cityretail.etl.service.EtlOrchestrator;
import com.cityretail.etl.service.EtlRunOptions;
import com.cityretail.etl.service.LoadReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command surface: {@code --force} re-cleans the raw files even when cleaned snapshots exist,
 * {@code --incremental} skips load-mode detection. Without flags the mode is detected from
 * the warehouse.
 */
@Component
public class EtlCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EtlCommandLineRunner.class);

    static final String FORCE = "force";
    static final String INCREMENTAL = "incremental";

    private final EtlOrchestrator orchestrator;

    public EtlCommandLineRunner(EtlOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        EtlRunOptions options = new EtlRunOptions(args.containsOption(FORCE), args.containsOption(INCREMENTAL));
        try {
            LoadReport report = orchestrator.run(options);
            log.info("ETL finished: {} mode, {} rows written", report.mode(), report.totalRowsWritten());
        } catch (RuntimeException e) {
            log.error("ETL run failed due to an unexpected error.", e);
            throw e;
        }
    }
}
