package com.cityretail.etl.warehouse;

/**
 * Result of inspecting the warehouse. {@code DETECTION_FAILED} carries the reason and runs
 * as a full load.
 */
public record LoadModeDecision(Outcome outcome, String reason) {

    public enum Outcome {
        FULL,
        INCREMENTAL,
        DETECTION_FAILED
    }

    public static LoadModeDecision full() {
        return new LoadModeDecision(Outcome.FULL, null);
    }

    public static LoadModeDecision incremental() {
        return new LoadModeDecision(Outcome.INCREMENTAL, null);
    }

    public static LoadModeDecision detectionFailed(String reason) {
        return new LoadModeDecision(Outcome.DETECTION_FAILED, reason);
    }

    public LoadMode mode() {
        return outcome == Outcome.INCREMENTAL ? LoadMode.INCREMENTAL : LoadMode.FULL;
    }
}
