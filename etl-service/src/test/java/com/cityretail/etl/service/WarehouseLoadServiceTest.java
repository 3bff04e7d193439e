package com.cityretail.etl.service;

import com.cityretail.etl.config.EtlProperties;
import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.exception.WarehouseLoadException;
import com.cityretail.etl.snapshot.CleanedSnapshotStore;
import com.cityretail.etl.warehouse.LoadMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WarehouseLoadService Tests")
class WarehouseLoadServiceTest {

    @TempDir
    Path dataDir;

    private RecordingWarehouseRepository repository;
    private CleanedSnapshotStore snapshotStore;
    private WarehouseLoadService service;

    @BeforeEach
    void setUp() {
        EtlProperties properties = new EtlProperties();
        properties.setDataPath(dataDir.toString());
        repository = new RecordingWarehouseRepository();
        snapshotStore = new CleanedSnapshotStore(properties);
        service = new WarehouseLoadService(repository, snapshotStore, TransactionOperations.withoutTransaction());
    }

    @Test
    @DisplayName("Full load should clear sales first and insert sales last")
    void testLoadFull_Ordering() {
        LoadReport report = service.loadFull(cleaned(List.of("1", "2"), List.of("100")));

        assertEquals(List.of(
                "DELETE factsales",
                "DELETE dimproduct", "INSERT dimproduct",
                "DELETE dimstore", "INSERT dimstore",
                "DELETE dimdate", "INSERT dimdate",
                "DELETE factsales", "INSERT factsales"), repository.commands);
        assertEquals(LoadMode.FULL, report.mode());
        assertEquals(2, report.result(WarehouseTable.PRODUCT).orElseThrow().rowsWritten());
        assertEquals(5, report.totalRowsWritten());
    }

    @Test
    @DisplayName("Full load should replace rows the warehouse already had")
    void testLoadFull_Replaces() {
        repository.seed(WarehouseTable.PRODUCT, product("99", "Old"));

        service.loadFull(cleaned(List.of("1"), List.of("100")));

        assertEquals(List.of(1L), List.copyOf(repository.rows(WarehouseTable.PRODUCT).keySet()));
    }

    @Test
    @DisplayName("Incremental load should upsert and append only unseen keys")
    void testLoadIncremental_OnlyNewRows() throws Exception {
        repository.seed(WarehouseTable.PRODUCT, product("7", "Tea"));

        LoadReport report = service.loadIncremental(cleaned(List.of("7", "8"), List.of("100")));

        DataTable upserted = repository.upserted.get(WarehouseTable.PRODUCT).get(0);
        assertEquals(1, upserted.size());
        assertEquals("8", upserted.rows().get(0).get("productid"));
        assertEquals(1, report.result(WarehouseTable.PRODUCT).orElseThrow().rowsWritten());
        assertEquals(LoadMode.INCREMENTAL, report.mode());

        List<String> lines = Files.readAllLines(snapshotStore.pathOf(WarehouseTable.PRODUCT));
        assertEquals(List.of("productid,productname", "8,Coffee"), lines);
    }

    @Test
    @DisplayName("A second incremental run over the same input should write nothing")
    void testLoadIncremental_Idempotent() {
        Map<WarehouseTable, DataTable> input = cleaned(List.of("1", "2"), List.of("100", "101"));

        LoadReport first = service.loadIncremental(input);
        LoadReport second = service.loadIncremental(input);

        assertEquals(6, first.totalRowsWritten());
        assertEquals(0, second.totalRowsWritten());
        assertTrue(second.tables().stream().allMatch(TableLoadResult::skipped));
        assertEquals(2, repository.rows(WarehouseTable.SALES).size());
    }

    @Test
    @DisplayName("Incremental load should visit tables in dependency order")
    void testLoadIncremental_Ordering() {
        service.loadIncremental(cleaned(List.of("1"), List.of("100")));

        assertEquals(List.of(
                "SELECT dimproduct", "UPSERT dimproduct",
                "SELECT dimstore", "UPSERT dimstore",
                "SELECT dimdate", "UPSERT dimdate",
                "SELECT factsales", "UPSERT factsales"), repository.commands);
    }

    @Test
    @DisplayName("A rejected upsert should surface as WarehouseLoadException naming the table")
    void testLoadIncremental_UpsertFailure() {
        repository.failOn(WarehouseTable.SALES);

        WarehouseLoadException e = assertThrows(WarehouseLoadException.class,
                () -> service.loadIncremental(cleaned(List.of("1"), List.of("100"))));
        assertEquals("factsales", e.getTableName());
    }

    @Test
    @DisplayName("A column the table does not define should fail the load with the table named")
    void testLoadFull_UnknownColumn() {
        Map<WarehouseTable, DataTable> input = cleaned(List.of("1"), List.of("100"));
        input.put(WarehouseTable.STORE, new DataTable("stores", List.of("storeid", "manager"),
                List.of(Map.of("storeid", "1", "manager", "Ana"))));

        WarehouseLoadException e = assertThrows(WarehouseLoadException.class, () -> service.loadFull(input));
        assertEquals("dimstore", e.getTableName());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertFalse(repository.commands.contains("INSERT factsales"));
    }

    @Test
    @DisplayName("Sales dateid written as a float should be loaded as an integer")
    void testLoadFull_CoercesDateId() {
        Map<WarehouseTable, DataTable> input = cleaned(List.of("1"), List.of("100"));

        service.loadFull(input);

        Map<String, Object> sale = repository.rows(WarehouseTable.SALES).get(100L);
        assertEquals(20240101L, sale.get("dateid"));
    }

    @Test
    @DisplayName("Should fail when a table has no cleaned data")
    void testLoadFull_MissingTable() {
        Map<WarehouseTable, DataTable> input = cleaned(List.of("1"), List.of("100"));
        input.remove(WarehouseTable.DATE);

        assertThrows(IllegalStateException.class, () -> service.loadFull(input));
    }

    private static Map<WarehouseTable, DataTable> cleaned(List<String> productIds, List<String> salesIds) {
        Map<WarehouseTable, DataTable> cleaned = new EnumMap<>(WarehouseTable.class);
        cleaned.put(WarehouseTable.PRODUCT, new DataTable("products", List.of("productid", "productname"),
                productIds.stream().map(id -> product(id, id.equals("8") ? "Coffee" : "Tea")).toList()));
        cleaned.put(WarehouseTable.STORE, new DataTable("stores", List.of("storeid", "storename"),
                List.of(Map.of("storeid", "1", "storename", "Central"))));
        cleaned.put(WarehouseTable.DATE, new DataTable("calendar", List.of("dateid", "year"),
                List.of(Map.of("dateid", "20240101", "year", "2024"))));
        cleaned.put(WarehouseTable.SALES, new DataTable("sales",
                List.of("salesid", "dateid", "productid", "storeid"),
                salesIds.stream().map(WarehouseLoadServiceTest::sale).toList()));
        return cleaned;
    }

    private static Map<String, Object> product(String id, String name) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("productid", id);
        row.put("productname", name);
        return row;
    }

    private static Map<String, Object> sale(String id) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("salesid", id);
        row.put("dateid", "20240101.0");
        row.put("productid", "1");
        row.put("storeid", "1");
        return row;
    }
}
