package com.cityretail.etl.domain;

public record WarehouseColumn(String name, ColumnType type) {
}
