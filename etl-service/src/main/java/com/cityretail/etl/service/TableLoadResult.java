package com.cityretail.etl.service;

import com.cityretail.etl.domain.WarehouseTable;

import java.time.Duration;

public record TableLoadResult(
        WarehouseTable table,
        int rowsWritten,
        Duration elapsed,
        boolean skipped
) {

    public static TableLoadResult written(WarehouseTable table, int rows, Duration elapsed) {
        return new TableLoadResult(table, rows, elapsed, false);
    }

    public static TableLoadResult unchanged(WarehouseTable table, Duration elapsed) {
        return new TableLoadResult(table, 0, elapsed, true);
    }
}
