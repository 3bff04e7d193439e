package com.cityretail.etl.service;

import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.exception.DataCoercionException;

import java.util.Map;
import java.util.Set;

/**
 * Delta by key presence: a cleaned row is new when its key is not already in the warehouse.
 * Changes to non-key columns of existing rows are not detected.
 */
public final class DeltaCalculator {

    private DeltaCalculator() {
    }

    public static DataTable newRows(WarehouseTable table, DataTable cleaned, Set<Long> existingKeys) {
        if (!cleaned.hasColumn(table.keyColumn())) {
            throw new IllegalArgumentException(
                    "Key column '" + table.keyColumn() + "' missing from cleaned " + cleaned.name());
        }
        return cleaned.filter(row -> !existingKeys.contains(key(table, row)));
    }

    static Long key(WarehouseTable table, Map<String, Object> row) {
        Object key = table.keyType().toSqlValue(row.get(table.keyColumn()));
        if (key == null) {
            throw new DataCoercionException("Row of " + table.tableName() + " has no " + table.keyColumn());
        }
        return (Long) key;
    }
}
