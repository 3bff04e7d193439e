package com.cityretail.etl.service;

/**
 * @param forceClean  re-run extraction and cleaning even when cleaned snapshots exist
 * @param incremental skip mode detection and run incrementally
 */
public record EtlRunOptions(boolean forceClean, boolean incremental) {
}
