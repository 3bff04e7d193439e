package com.cityretail.etl.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory tabular data: an ordered list of lowercase column names and the rows keyed by them.
 * Row maps preserve column order and may hold {@code null} values for missing cells.
 */
public record DataTable(
        String name,
        List<String> columns,
        List<Map<String, Object>> rows) {

    public DataTable {
        columns = List.copyOf(columns);
        var copied = new ArrayList<Map<String, Object>>(rows.size());
        for (Map<String, Object> row : rows) {
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public static DataTable empty(String name, List<String> columns) {
        return new DataTable(name, columns, List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public DataTable filter(Predicate<Map<String, Object>> predicate) {
        return new DataTable(name, columns, rows.stream().filter(predicate).toList());
    }

    /**
     * Applies {@code mapper} to a mutable copy of every row. Columns added by the mapper must
     * be listed in {@code newColumns}.
     */
    public DataTable mapRows(List<String> newColumns, UnaryOperator<Map<String, Object>> mapper) {
        var mapped = new ArrayList<Map<String, Object>>(rows.size());
        for (Map<String, Object> row : rows) {
            mapped.add(mapper.apply(new LinkedHashMap<>(row)));
        }
        return new DataTable(name, newColumns, mapped);
    }
}
