package com.cityretail.etl.exception;

public class WarehouseConnectionException extends RuntimeException {

    public WarehouseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
