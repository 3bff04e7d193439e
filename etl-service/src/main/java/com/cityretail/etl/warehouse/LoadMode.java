package com.cityretail.etl.warehouse;

public enum LoadMode {
    FULL,
    INCREMENTAL
}
