package com.cityretail.etl.service;

import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.exception.DataCoercionException;
import com.cityretail.etl.exception.WarehouseLoadException;
import com.cityretail.etl.repository.WarehouseRepository;
import com.cityretail.etl.snapshot.CleanedSnapshotStore;
import com.cityretail.etl.warehouse.LoadMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persists cleaned tables into the warehouse in dependency order (dimensions, then sales).
 *
 * <p>A full load replaces every table: sales are cleared first so that dimension deletes are
 * not blocked by foreign keys, then each table is deleted and bulk inserted in its own
 * transaction. An incremental load runs in a single transaction and only upserts rows whose
 * key the warehouse does not have yet, appending those rows to the cleaned snapshots.
 */
@Service
public class WarehouseLoadService {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseLoadService.class);

    private final WarehouseRepository repository;
    private final CleanedSnapshotStore snapshotStore;
    private final TransactionOperations transactions;

    public WarehouseLoadService(WarehouseRepository repository,
                                CleanedSnapshotStore snapshotStore,
                                TransactionOperations transactions) {
        this.repository = repository;
        this.snapshotStore = snapshotStore;
        this.transactions = transactions;
    }

    public LoadReport loadFull(Map<WarehouseTable, DataTable> cleaned) {
        logger.info("Starting full data load to PostgreSQL...");
        long start = System.nanoTime();

        transactions.executeWithoutResult(status -> {
            for (WarehouseTable table : WarehouseTable.values()) {
                if (table.isFact()) {
                    clear(table);
                }
            }
        });

        List<TableLoadResult> results = new ArrayList<>();
        for (WarehouseTable table : WarehouseTable.values()) {
            DataTable data = table.coerceForeignKeys(require(cleaned, table));
            results.add(transactions.execute(status -> replace(table, data)));
        }

        Duration total = elapsedSince(start);
        logger.info("Total ETL load time: {} seconds", seconds(total));
        return new LoadReport(LoadMode.FULL, results, total);
    }

    public LoadReport loadIncremental(Map<WarehouseTable, DataTable> cleaned) {
        logger.info("[Incremental ETL] Starting process...");
        long start = System.nanoTime();

        List<TableLoadResult> results = transactions.execute(status -> {
            var loaded = new ArrayList<TableLoadResult>();
            for (WarehouseTable table : WarehouseTable.values()) {
                loaded.add(loadDelta(table, require(cleaned, table)));
            }
            return loaded;
        });

        Duration total = elapsedSince(start);
        LoadReport report = new LoadReport(LoadMode.INCREMENTAL, results == null ? List.of() : results, total);
        logger.info("[Incremental ETL] {} new rows committed in {} seconds.", report.totalRowsWritten(), seconds(total));
        return report;
    }

    private TableLoadResult replace(WarehouseTable table, DataTable data) {
        long start = System.nanoTime();
        logger.info("Loading {} ({} rows)", table.tableName(), data.size());
        clear(table);
        int inserted = write(table, "insert", () -> repository.insertAll(table, data));
        logger.info("Inserted {} rows into {}", inserted, table.tableName());

        Duration elapsed = elapsedSince(start);
        logger.info("Loaded {} in {} seconds", table.tableName(), seconds(elapsed));
        return TableLoadResult.written(table, inserted, elapsed);
    }

    private TableLoadResult loadDelta(WarehouseTable table, DataTable cleaned) {
        long start = System.nanoTime();
        DataTable data = table.coerceForeignKeys(cleaned);

        Set<Long> existingKeys = write(table, "fetch existing keys", () -> repository.fetchExistingKeys(table));
        DataTable delta = DeltaCalculator.newRows(table, data, existingKeys);
        logger.debug("[{}] Filtered {} existing rows.", table.tableName(), data.size() - delta.size());

        if (delta.isEmpty()) {
            logger.info("[{}] No new rows to insert.", table.tableName());
            Duration elapsed = elapsedSince(start);
            logger.info("[{}] Completed in {} seconds", table.tableName(), seconds(elapsed));
            return TableLoadResult.unchanged(table, elapsed);
        }

        snapshotStore.append(table, delta);
        int upserted = write(table, "upsert", () -> repository.upsertAll(table, delta));
        logger.info("[{}] Inserted/Updated {} rows.", table.tableName(), upserted);

        Duration elapsed = elapsedSince(start);
        logger.info("[{}] Completed in {} seconds", table.tableName(), seconds(elapsed));
        return TableLoadResult.written(table, upserted, elapsed);
    }

    private void clear(WarehouseTable table) {
        write(table, "clear", () -> {
            repository.deleteAll(table);
            return null;
        });
    }

    private <T> T write(WarehouseTable table, String operation, WarehouseCall<T> call) {
        try {
            return call.run();
        } catch (DataAccessException e) {
            logger.error("[{}] Error during {}", table.tableName(), operation, e);
            throw new WarehouseLoadException(table.tableName(), operation + " failed: " + e.getMessage(), e);
        } catch (DataCoercionException e) {
            logger.error("[{}] Bad value during {}", table.tableName(), operation, e);
            throw e;
        } catch (IllegalArgumentException e) {
            // column not defined for the table
            logger.error("[{}] Rejected columns during {}", table.tableName(), operation, e);
            throw new WarehouseLoadException(table.tableName(), operation + " rejected: " + e.getMessage(), e);
        }
    }

    private static DataTable require(Map<WarehouseTable, DataTable> cleaned, WarehouseTable table) {
        DataTable data = cleaned.get(table);
        if (data == null) {
            throw new IllegalStateException("No cleaned data for " + table.tableName());
        }
        return data;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String seconds(Duration duration) {
        return String.format("%.2f", duration.toMillis() / 1000.0);
    }

    @FunctionalInterface
    private interface WarehouseCall<T> {
        T run();
    }
}
