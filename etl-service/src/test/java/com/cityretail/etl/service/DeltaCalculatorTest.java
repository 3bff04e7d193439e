package com.cityretail.etl.service;

import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.exception.DataCoercionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeltaCalculator Tests")
class DeltaCalculatorTest {

    @Test
    @DisplayName("Should keep only rows whose key is not in the warehouse")
    void testNewRows_KeyPresence() {
        DataTable products = products(row("7", "Tea"), row("8", "Coffee"), row("9.0", "Cocoa"));

        DataTable delta = DeltaCalculator.newRows(WarehouseTable.PRODUCT, products, Set.of(7L, 9L));

        assertEquals(1, delta.size());
        assertEquals("8", delta.rows().get(0).get("productid"));
    }

    @Test
    @DisplayName("Should ignore changes to non-key columns of existing rows")
    void testNewRows_UpdatesInvisible() {
        DataTable products = products(row("7", "Renamed tea"));

        assertTrue(DeltaCalculator.newRows(WarehouseTable.PRODUCT, products, Set.of(7L)).isEmpty());
    }

    @Test
    @DisplayName("Should return every row when the warehouse table is empty")
    void testNewRows_EmptyWarehouse() {
        DataTable products = products(row("1", "Tea"), row("2", "Coffee"));

        assertEquals(2, DeltaCalculator.newRows(WarehouseTable.PRODUCT, products, Set.of()).size());
    }

    @Test
    @DisplayName("Should fail on a row without a key")
    void testNewRows_NullKey() {
        DataTable products = products(row(null, "Mystery"));

        assertThrows(DataCoercionException.class,
                () -> DeltaCalculator.newRows(WarehouseTable.PRODUCT, products, Set.of()));
    }

    @Test
    @DisplayName("Should fail when the key column is missing")
    void testNewRows_MissingKeyColumn() {
        DataTable names = new DataTable("products", List.of("productname"), List.of(Map.of("productname", "Tea")));

        assertThrows(IllegalArgumentException.class,
                () -> DeltaCalculator.newRows(WarehouseTable.PRODUCT, names, Set.of()));
    }

    private static Map<String, Object> row(String id, String name) {
        Map<String, Object> row = new HashMap<>();
        row.put("productid", id);
        row.put("productname", name);
        return row;
    }

    @SafeVarargs
    private static DataTable products(Map<String, Object>... rows) {
        return new DataTable("products", List.of("productid", "productname"), List.of(rows));
    }
}
