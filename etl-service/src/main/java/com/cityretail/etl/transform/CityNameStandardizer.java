package com.cityretail.etl.transform;

import com.cityretail.etl.domain.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the free-text city of each store with its standardized name from the
 * {@code cities_lookup} table ({@code rawcity -> standardcity}).
 */
@Component
@Slf4j
public class CityNameStandardizer {

    static final String CITY = "city";
    static final String RAW_CITY = "rawcity";
    static final String STANDARD_CITY = "standardcity";

    /**
     * Left join of stores to the lookup. Every store row is kept exactly once; rows without a
     * mapping get a {@code null} city and are reported in a single warning.
     */
    public DataTable standardize(DataTable stores, DataTable cityLookup) {
        Map<Object, Object> mapping = buildMapping(cityLookup);

        List<String> columns = stores.hasColumn(CITY)
                ? stores.columns()
                : append(stores.columns(), CITY);

        DataTable cleaned = stores.mapRows(columns, row -> {
            Object raw = row.get(CITY);
            row.put(CITY, raw == null ? null : mapping.get(raw));
            return row;
        });

        List<Map<String, Object>> unmapped = cleaned.rows().stream()
                .filter(row -> row.get(CITY) == null)
                .map(CityNameStandardizer::describe)
                .toList();
        if (!unmapped.isEmpty()) {
            log.warn("Some cities could not be standardized.");
            log.warn("Unmapped cities: {}", unmapped);
        }
        return cleaned;
    }

    private Map<Object, Object> buildMapping(DataTable cityLookup) {
        Map<Object, Object> mapping = new HashMap<>();
        for (Map<String, Object> row : cityLookup.rows()) {
            Object raw = row.get(RAW_CITY);
            if (raw == null) {
                continue;
            }
            Object previous = mapping.putIfAbsent(raw, row.get(STANDARD_CITY));
            if (previous != null && !previous.equals(row.get(STANDARD_CITY))) {
                log.warn("Duplicate lookup entry for city '{}', keeping '{}'", raw, previous);
            }
        }
        return mapping;
    }

    private static Map<String, Object> describe(Map<String, Object> row) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("storeid", row.get("storeid"));
        summary.put("storename", row.get("storename"));
        summary.put("region", row.get("region"));
        return summary;
    }

    private static List<String> append(List<String> columns, String column) {
        var extended = new ArrayList<>(columns);
        extended.add(column);
        return extended;
    }
}
