package com.cityretail.etl.repository;

import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;

import java.util.Set;

public interface WarehouseRepository {

    Set<Long> fetchExistingKeys(WarehouseTable table);

    long countRows(WarehouseTable table);

    void deleteAll(WarehouseTable table);

    /** Plain batched INSERT of every row; used after {@link #deleteAll} on a full reload. */
    int insertAll(WarehouseTable table, DataTable rows);

    /** Batched INSERT ... ON CONFLICT (key) DO UPDATE of every row. */
    int upsertAll(WarehouseTable table, DataTable rows);

    void executeScript(String sql);
}
