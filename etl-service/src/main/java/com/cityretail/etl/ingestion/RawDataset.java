package com.cityretail.etl.ingestion;

import com.cityretail.etl.domain.DataTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The raw tables that loaded successfully in one run, keyed by name
 * ({@code calendar}, {@code cities_lookup}, {@code products}, {@code sales}, {@code stores}).
 */
public class RawDataset {

    private final Map<String, DataTable> tables;

    public RawDataset(Map<String, DataTable> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public DataTable require(String name) {
        DataTable table = tables.get(name);
        if (table == null) {
            throw new IllegalStateException("Raw table '" + name + "' was not loaded");
        }
        return table;
    }

    public Set<String> names() {
        return tables.keySet();
    }
}
