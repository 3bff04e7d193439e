package com.cityretail.etl.service;

import com.cityretail.etl.config.EtlProperties;
import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.ingestion.RawDataLoader;
import com.cityretail.etl.ingestion.RawDataset;
import com.cityretail.etl.snapshot.CleanedSnapshotStore;
import com.cityretail.etl.transform.CalendarDateParser;
import com.cityretail.etl.transform.CityNameStandardizer;
import com.cityretail.etl.warehouse.LoadMode;
import com.cityretail.etl.warehouse.LoadModeDecision;
import com.cityretail.etl.warehouse.WarehouseConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

@Service
@Slf4j
public class EtlOrchestrator {

    private final EtlProperties properties;
    private final RawDataLoader rawDataLoader;
    private final CityNameStandardizer cityNameStandardizer;
    private final CalendarDateParser calendarDateParser;
    private final CleanedSnapshotStore snapshotStore;
    private final WarehouseConnectionManager connectionManager;
    private final WarehouseLoadService loadService;
    private final MaintenanceScriptRunner maintenanceScripts;

    public EtlOrchestrator(EtlProperties properties,
                           RawDataLoader rawDataLoader,
                           CityNameStandardizer cityNameStandardizer,
                           CalendarDateParser calendarDateParser,
                           CleanedSnapshotStore snapshotStore,
                           WarehouseConnectionManager connectionManager,
                           WarehouseLoadService loadService,
                           MaintenanceScriptRunner maintenanceScripts) {
        this.properties = properties;
        this.rawDataLoader = rawDataLoader;
        this.cityNameStandardizer = cityNameStandardizer;
        this.calendarDateParser = calendarDateParser;
        this.snapshotStore = snapshotStore;
        this.connectionManager = connectionManager;
        this.loadService = loadService;
        this.maintenanceScripts = maintenanceScripts;
    }

    public LoadReport run(EtlRunOptions options) {
        log.info("Starting CityRetail ETL process...");
        properties.createDirectories();
        connectionManager.waitUntilReady();

        LoadMode mode = resolveMode(options);
        log.info("Running in {} mode...", mode.name().toLowerCase());

        LoadReport report = mode == LoadMode.INCREMENTAL
                ? runIncremental()
                : runFull(options.forceClean());

        maintenanceScripts.runAll();
        log.info("{} ETL process complete.", mode == LoadMode.INCREMENTAL ? "Incremental" : "Full");
        return report;
    }

    LoadMode resolveMode(EtlRunOptions options) {
        if (options.incremental()) {
            return LoadMode.INCREMENTAL;
        }
        LoadModeDecision decision = connectionManager.detectLoadMode();
        if (decision.outcome() == LoadModeDecision.Outcome.DETECTION_FAILED) {
            log.warn("Load mode detection failed ({}); falling back to full load.", decision.reason());
        }
        return decision.mode();
    }

    LoadReport runIncremental() {
        log.info("Incremental mode: Processing only new rows from raw files.");
        Map<WarehouseTable, DataTable> cleaned = clean(rawDataLoader.load());
        return loadService.loadIncremental(cleaned);
    }

    LoadReport runFull(boolean forceClean) {
        if (!forceClean && snapshotStore.allExist()) {
            log.info("Cleaned files already exist. Skipping raw extraction and cleaning.");
        } else {
            log.info("Full mode: Cleaning and loading entire dataset from scratch.");
            Map<WarehouseTable, DataTable> cleaned = clean(rawDataLoader.load());
            log.info("Saving cleaned data to disk...");
            snapshotStore.saveAll(cleaned);
        }

        Map<WarehouseTable, DataTable> snapshots = new EnumMap<>(WarehouseTable.class);
        for (WarehouseTable table : WarehouseTable.values()) {
            snapshots.put(table, snapshotStore.read(table));
        }
        log.info("Running full table load to PostgreSQL...");
        return loadService.loadFull(snapshots);
    }

    /**
     * Stores get standardized city names, the calendar gets parsed dates and derived week
     * fields; products and sales pass through unchanged.
     */
    Map<WarehouseTable, DataTable> clean(RawDataset raw) {
        Map<WarehouseTable, DataTable> cleaned = new EnumMap<>(WarehouseTable.class);
        cleaned.put(WarehouseTable.PRODUCT, raw.require("products"));
        cleaned.put(WarehouseTable.STORE,
                cityNameStandardizer.standardize(raw.require("stores"), raw.require("cities_lookup")));
        cleaned.put(WarehouseTable.DATE, calendarDateParser.parse(raw.require("calendar")));
        cleaned.put(WarehouseTable.SALES, raw.require("sales"));
        return cleaned;
    }
}
