package com.cityretail.etl.exception;

/**
 * Raised when required configuration (warehouse credentials) is absent.
 * Always fatal and thrown before any I/O happens.
 */
public class EtlConfigurationException extends RuntimeException {

    public EtlConfigurationException(String message) {
        super(message);
    }
}
