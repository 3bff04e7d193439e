package com.cityretail.etl.service;

import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.warehouse.LoadMode;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public record LoadReport(
        LoadMode mode,
        List<TableLoadResult> tables,
        Duration elapsed
) {

    public LoadReport {
        tables = List.copyOf(tables);
    }

    public int totalRowsWritten() {
        return tables.stream().mapToInt(TableLoadResult::rowsWritten).sum();
    }

    public Optional<TableLoadResult> result(WarehouseTable table) {
        return tables.stream().filter(r -> r.table() == table).findFirst();
    }
}
