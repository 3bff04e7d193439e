package com.cityretail.etl.repository;

import com.cityretail.etl.domain.WarehouseTable;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the small SQL dialect the loader needs. Identifiers come only from
 * {@link WarehouseTable}; values are always bound as {@code ?} parameters.
 */
public final class WarehouseSqlBuilder {

    private WarehouseSqlBuilder() {
    }

    public static String selectKeys(WarehouseTable table) {
        return "SELECT " + table.keyColumn() + " FROM " + table.tableName();
    }

    public static String countRows(WarehouseTable table) {
        return "SELECT COUNT(*) FROM " + table.tableName();
    }

    public static String deleteAll(WarehouseTable table) {
        return "DELETE FROM " + table.tableName();
    }

    public static String insert(WarehouseTable table, List<String> columns) {
        validate(table, columns);
        return "INSERT INTO " + table.tableName()
                + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + placeholders(columns.size()) + ")";
    }

    /**
     * INSERT that updates every non-key column to the incoming value when the key already
     * exists. A key-only column list degrades to {@code DO NOTHING}.
     */
    public static String upsert(WarehouseTable table, List<String> columns) {
        validate(table, columns);
        String updates = columns.stream()
                .filter(c -> !c.equals(table.keyColumn()))
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(", "));

        String conflict = updates.isEmpty()
                ? " ON CONFLICT (" + table.keyColumn() + ") DO NOTHING"
                : " ON CONFLICT (" + table.keyColumn() + ") DO UPDATE SET " + updates;
        return insert(table, columns) + conflict;
    }

    /**
     * Rejects any column the registry does not know for {@code table}, and a column list that
     * lacks the key.
     */
    static void validate(WarehouseTable table, List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No columns given for " + table.tableName());
        }
        for (String column : columns) {
            if (table.column(column).isEmpty()) {
                throw new IllegalArgumentException(
                        "Column '" + column + "' is not defined for table " + table.tableName());
            }
        }
        if (!columns.contains(table.keyColumn())) {
            throw new IllegalArgumentException(
                    "Key column '" + table.keyColumn() + "' missing for table " + table.tableName());
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
