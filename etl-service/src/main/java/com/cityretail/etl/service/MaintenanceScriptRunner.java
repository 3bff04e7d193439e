package com.cityretail.etl.service;

import com.cityretail.etl.config.EtlProperties;
import com.cityretail.etl.repository.WarehouseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Rebuilds the KPI reporting views and indexes after a load. These are derived artifacts:
 * a failure is logged and the load still counts as successful.
 */
@Component
@Slf4j
public class MaintenanceScriptRunner {

    static final List<String> SCRIPTS = List.of("kpi_views.sql", "kpi_indexes.sql");

    private final WarehouseRepository repository;
    private final ResourceLoader resourceLoader;
    private final EtlProperties properties;

    public MaintenanceScriptRunner(WarehouseRepository repository,
                                   ResourceLoader resourceLoader,
                                   EtlProperties properties) {
        this.repository = repository;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    /**
     * @return {@code true} when both scripts ran
     */
    public boolean runAll() {
        try {
            for (String script : SCRIPTS) {
                repository.executeScript(read(script));
                log.info("Executed SQL file: {}", script);
            }
            log.info("KPI views and indexes created successfully.");
            return true;
        } catch (IOException | DataAccessException e) {
            log.error("Error creating KPI views/indexes", e);
            return false;
        }
    }

    private String read(String script) throws IOException {
        String location = properties.getSqlLocation();
        Resource resource = resourceLoader.getResource(location.endsWith("/") ? location + script : location + "/" + script);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        }
    }
}
