package com.cityretail.etl.exception;

/**
 * The warehouse did not accept a connection within the configured retry budget.
 */
public class WarehouseUnavailableException extends RuntimeException {

    public WarehouseUnavailableException(String message) {
        super(message);
    }

    public WarehouseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
