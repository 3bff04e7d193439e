package com.cityretail.etl.warehouse;

import com.cityretail.etl.config.WarehouseProperties;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.exception.WarehouseConnectionException;
import com.cityretail.etl.exception.WarehouseUnavailableException;
import com.cityretail.etl.repository.WarehouseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Opens warehouse connections, waits for the database to come up, and decides between a full
 * and an incremental load from the state of {@code dimproduct}.
 */
@Component
@Slf4j
public class WarehouseConnectionManager {

    static final WarehouseTable MODE_PROBE_TABLE = WarehouseTable.PRODUCT;

    private final WarehouseProperties properties;
    private final DataSource dataSource;
    private final WarehouseRepository repository;
    private final Sleeper sleeper;

    @Autowired
    public WarehouseConnectionManager(WarehouseProperties properties,
                                      DataSource dataSource,
                                      WarehouseRepository repository) {
        this(properties, dataSource, repository, Sleeper.THREAD);
    }

    WarehouseConnectionManager(WarehouseProperties properties,
                               DataSource dataSource,
                               WarehouseRepository repository,
                               Sleeper sleeper) {
        this.properties = properties;
        this.dataSource = dataSource;
        this.repository = repository;
        this.sleeper = sleeper;
    }

    public Connection connect() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new WarehouseConnectionException(
                    "Cannot connect to warehouse at " + properties.jdbcUrl() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Tries to connect up to {@code warehouse.retries} times. After failed attempt {@code n}
     * it waits {@code initialDelaySeconds^n} seconds.
     */
    public void waitUntilReady() {
        int retries = properties.getRetries();
        for (int attempt = 1; attempt <= retries; attempt++) {
            try (Connection ignored = connect()) {
                log.info("PostgreSQL is ready.");
                return;
            } catch (WarehouseConnectionException | SQLException e) {
                if (attempt == retries) {
                    break;
                }
                Duration wait = backoff(attempt);
                log.warn("[Retry {}/{}] PostgreSQL not ready: {}. Retrying in {} seconds...",
                        attempt, retries, e.getMessage(), wait.toSeconds());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new WarehouseUnavailableException("Interrupted while waiting for PostgreSQL", interrupted);
                }
            }
        }
        log.error("PostgreSQL is not available after {} attempts.", retries);
        throw new WarehouseUnavailableException("PostgreSQL is not available after " + retries + " attempts");
    }

    public LoadModeDecision detectLoadMode() {
        try {
            long count = repository.countRows(MODE_PROBE_TABLE);
            log.info("Found {} rows in {}", count, MODE_PROBE_TABLE.tableName());
            return count > 0 ? LoadModeDecision.incremental() : LoadModeDecision.full();
        } catch (DataAccessException e) {
            log.warn("Could not query {} to check for incremental mode. Defaulting to full load.",
                    MODE_PROBE_TABLE.tableName(), e);
            return LoadModeDecision.detectionFailed(e.getMessage());
        }
    }

    Duration backoff(int attempt) {
        return Duration.ofSeconds((long) Math.pow(properties.getInitialDelaySeconds(), attempt));
    }
}
