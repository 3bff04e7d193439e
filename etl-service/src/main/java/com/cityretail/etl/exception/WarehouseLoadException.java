package com.cityretail.etl.exception;

/**
 * A clear, insert or upsert against a warehouse table failed. Aborts the run.
 */
public class WarehouseLoadException extends RuntimeException {

    private final String tableName;

    public WarehouseLoadException(String tableName, String message, Throwable cause) {
        super("[" + tableName + "] " + message, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
