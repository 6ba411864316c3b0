package com.taxitelemetry.shared.result;

import java.util.List;

/**
 * Counters reported by a stage for one delivered batch. {@code failed} covers both
 * rejected and failed records, so {@code processed + failed == total} for a batch
 * that ran; a batch stopped by missing configuration processes nothing.
 */
public record BatchResult(Status status, int processed, int failed, int total, String message) {

    public enum Status { COMPLETED, CONFIGURATION_ERROR }

    public static BatchResult of(List<RecordOutcome> outcomes) {
        int processed = (int) outcomes.stream().filter(RecordOutcome::isProcessed).count();
        int failed = outcomes.size() - processed;
        return new BatchResult(Status.COMPLETED, processed, failed, outcomes.size(),
                "Processed " + processed + " records, failed " + failed + " of " + outcomes.size());
    }

    public static BatchResult configurationError(int total, List<String> missingSettings) {
        return new BatchResult(Status.CONFIGURATION_ERROR, 0, 0, total,
                "Missing required configuration: " + missingSettings);
    }

    public boolean isConfigurationError() {
        return status == Status.CONFIGURATION_ERROR;
    }
}
