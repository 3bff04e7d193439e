package com.cityretail.etl.domain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.cityretail.etl.domain.ColumnType.BOOLEAN;
import static com.cityretail.etl.domain.ColumnType.DECIMAL;
import static com.cityretail.etl.domain.ColumnType.INTEGER;
import static com.cityretail.etl.domain.ColumnType.TEXT;

/**
 * Registry of the star-schema tables. Declaration order is the load order: dimensions first,
 * the sales fact last. Every identifier that reaches SQL text is taken from here.
 */
public enum WarehouseTable {

    PRODUCT("dimproduct", "productid", "products", Set.of(), List.of(
            new WarehouseColumn("productid", INTEGER),
            new WarehouseColumn("productname", TEXT),
            new WarehouseColumn("category", TEXT),
            new WarehouseColumn("subcategory", TEXT),
            new WarehouseColumn("costprice", DECIMAL),
            new WarehouseColumn("saleprice", DECIMAL))),

    STORE("dimstore", "storeid", "stores", Set.of(), List.of(
            new WarehouseColumn("storeid", INTEGER),
            new WarehouseColumn("storename", TEXT),
            new WarehouseColumn("city", TEXT),
            new WarehouseColumn("region", TEXT))),

    DATE("dimdate", "dateid", "calendar", Set.of(), List.of(
            new WarehouseColumn("dateid", INTEGER),
            new WarehouseColumn("date", ColumnType.DATE),
            new WarehouseColumn("year", INTEGER),
            new WarehouseColumn("quarter", INTEGER),
            new WarehouseColumn("month", INTEGER),
            new WarehouseColumn("day", INTEGER),
            new WarehouseColumn("weekday", TEXT),
            new WarehouseColumn("weeknumber", INTEGER),
            new WarehouseColumn("isweekend", BOOLEAN))),

    SALES("factsales", "salesid", "sales", Set.of("dateid"), List.of(
            new WarehouseColumn("salesid", INTEGER),
            new WarehouseColumn("dateid", INTEGER),
            new WarehouseColumn("productid", INTEGER),
            new WarehouseColumn("storeid", INTEGER),
            new WarehouseColumn("qtysold", INTEGER),
            new WarehouseColumn("revenue", DECIMAL)));

    private final String tableName;
    private final String keyColumn;
    private final String snapshotName;
    private final Set<String> coercedKeyColumns;
    private final List<WarehouseColumn> columns;

    WarehouseTable(String tableName, String keyColumn, String snapshotName,
                   Set<String> coercedKeyColumns, List<WarehouseColumn> columns) {
        this.tableName = tableName;
        this.keyColumn = keyColumn;
        this.snapshotName = snapshotName;
        this.coercedKeyColumns = coercedKeyColumns;
        this.columns = columns;
    }

    public String tableName() {
        return tableName;
    }

    public String keyColumn() {
        return keyColumn;
    }

    /** Base name of the raw and cleaned CSV files for this table. */
    public String snapshotName() {
        return snapshotName;
    }

    public List<WarehouseColumn> columns() {
        return columns;
    }

    public boolean isFact() {
        return this == SALES;
    }

    public Optional<WarehouseColumn> column(String name) {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public ColumnType keyType() {
        return column(keyColumn).orElseThrow().type();
    }

    /**
     * Converts the foreign key columns that are compared or bound as integers (the sales
     * {@code dateid}) into {@link Long} values. Tables without such columns are returned as is.
     */
    public DataTable coerceForeignKeys(DataTable data) {
        if (coercedKeyColumns.isEmpty()) {
            return data;
        }
        return data.mapRows(data.columns(), row -> {
            for (String column : coercedKeyColumns) {
                if (row.containsKey(column)) {
                    row.put(column, INTEGER.toSqlValue(row.get(column)));
                }
            }
            return row;
        });
    }
}
