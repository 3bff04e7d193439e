package com.cityretail.etl.service;

import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.repository.WarehouseRepository;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory warehouse that records every command it receives, in order.
 */
class RecordingWarehouseRepository implements WarehouseRepository {

    final List<String> commands = new ArrayList<>();
    final List<String> scripts = new ArrayList<>();
    final Map<WarehouseTable, List<DataTable>> upserted = new EnumMap<>(WarehouseTable.class);

    private final Map<WarehouseTable, Map<Long, Map<String, Object>>> tables = new EnumMap<>(WarehouseTable.class);
    private final Set<WarehouseTable> failing = EnumSet.noneOf(WarehouseTable.class);

    RecordingWarehouseRepository() {
        for (WarehouseTable table : WarehouseTable.values()) {
            tables.put(table, new LinkedHashMap<>());
        }
    }

    void seed(WarehouseTable table, Map<String, Object> row) {
        tables.get(table).put(DeltaCalculator.key(table, row), row);
    }

    void failOn(WarehouseTable table) {
        failing.add(table);
    }

    Map<Long, Map<String, Object>> rows(WarehouseTable table) {
        return tables.get(table);
    }

    @Override
    public Set<Long> fetchExistingKeys(WarehouseTable table) {
        commands.add("SELECT " + table.tableName());
        return Set.copyOf(tables.get(table).keySet());
    }

    @Override
    public long countRows(WarehouseTable table) {
        return tables.get(table).size();
    }

    @Override
    public void deleteAll(WarehouseTable table) {
        commands.add("DELETE " + table.tableName());
        tables.get(table).clear();
    }

    @Override
    public int insertAll(WarehouseTable table, DataTable rows) {
        commands.add("INSERT " + table.tableName());
        return write(table, rows);
    }

    @Override
    public int upsertAll(WarehouseTable table, DataTable rows) {
        commands.add("UPSERT " + table.tableName());
        upserted.computeIfAbsent(table, t -> new ArrayList<>()).add(rows);
        return write(table, rows);
    }

    @Override
    public void executeScript(String sql) {
        scripts.add(sql);
    }

    private int write(WarehouseTable table, DataTable rows) {
        for (String column : rows.columns()) {
            if (table.column(column).isEmpty()) {
                throw new IllegalArgumentException(
                        "Column '" + column + "' is not defined for table " + table.tableName());
            }
        }
        if (failing.contains(table)) {
            throw new DataIntegrityViolationException("violates foreign key constraint on " + table.tableName());
        }
        for (Map<String, Object> row : rows.rows()) {
            tables.get(table).put(DeltaCalculator.key(table, row), row);
        }
        return rows.size();
    }
}
