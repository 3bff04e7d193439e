package com.cityretail.etl.exception;

public class DataCoercionException extends RuntimeException {

    public DataCoercionException(String message) {
        super(message);
    }

    public DataCoercionException(String message, Throwable cause) {
        super(message, cause);
    }
}
