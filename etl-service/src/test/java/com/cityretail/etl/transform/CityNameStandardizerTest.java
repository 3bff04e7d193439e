package com.cityretail.etl.transform;

import com.cityretail.etl.domain.DataTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CityNameStandardizer Tests")
class CityNameStandardizerTest {

    private static final List<String> STORE_COLUMNS = List.of("storeid", "storename", "city", "region");

    private final CityNameStandardizer standardizer = new CityNameStandardizer();

    @Test
    @DisplayName("Should replace a raw city with its standardized name")
    void testStandardize_Mapped() {
        DataTable stores = stores(store("1", "NYC"));
        DataTable lookup = lookup(Map.of("rawcity", "NYC", "standardcity", "New York"));

        DataTable cleaned = standardizer.standardize(stores, lookup);

        assertEquals(1, cleaned.size());
        assertEquals("New York", cleaned.rows().get(0).get("city"));
        assertEquals("1", cleaned.rows().get(0).get("storeid"));
        assertEquals(STORE_COLUMNS, cleaned.columns());
    }

    @Test
    @DisplayName("Should keep an unmapped store with a null city")
    void testStandardize_Unmapped() {
        DataTable stores = stores(store("1", "NYC"));
        DataTable lookup = lookup(Map.of("rawcity", "LA", "standardcity", "Los Angeles"));

        DataTable cleaned = standardizer.standardize(stores, lookup);

        assertEquals(1, cleaned.size());
        assertNull(cleaned.rows().get(0).get("city"));
        assertTrue(cleaned.rows().get(0).containsKey("city"));
    }

    @Test
    @DisplayName("Should preserve row count with duplicate lookup entries and missing cities")
    void testStandardize_PreservesRowCount() {
        DataTable stores = stores(store("1", "NYC"), store("2", null), store("3", "Athina"), store("4", "NYC"));
        DataTable lookup = lookup(
                Map.of("rawcity", "NYC", "standardcity", "New York"),
                Map.of("rawcity", "NYC", "standardcity", "New York City"),
                Map.of("rawcity", "Athina", "standardcity", "Athens"));

        DataTable cleaned = standardizer.standardize(stores, lookup);

        assertEquals(stores.size(), cleaned.size());
        assertEquals("New York", cleaned.rows().get(0).get("city"));
        assertNull(cleaned.rows().get(1).get("city"));
        assertEquals("Athens", cleaned.rows().get(2).get("city"));
        assertEquals("New York", cleaned.rows().get(3).get("city"));
    }

    private static Map<String, Object> store(String id, String city) {
        Map<String, Object> row = new HashMap<>();
        row.put("storeid", id);
        row.put("storename", "Store " + id);
        row.put("city", city);
        row.put("region", "East");
        return row;
    }

    @SafeVarargs
    private static DataTable stores(Map<String, Object>... rows) {
        return new DataTable("stores", STORE_COLUMNS, List.of(rows));
    }

    @SafeVarargs
    private static DataTable lookup(Map<String, Object>... rows) {
        return new DataTable("cities_lookup", List.of("rawcity", "standardcity"), List.of(rows));
    }
}
