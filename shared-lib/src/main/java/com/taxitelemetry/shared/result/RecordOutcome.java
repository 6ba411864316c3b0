package com.taxitelemetry.shared.result;

/**
 * Result of handling one message inside a batch. Stages return one of these per
 * record instead of letting an exception decide the control flow.
 */
public record RecordOutcome(String tripId, Status status, String reason) {

    public enum Status {
        /** All effects for the record completed. */
        PROCESSED,
        /** The record itself was bad: undecodable or invalid. */
        REJECTED,
        /** A downstream call failed for this record. */
        FAILED
    }

    public static RecordOutcome processed(String tripId) {
        return new RecordOutcome(tripId, Status.PROCESSED, null);
    }

    public static RecordOutcome rejected(String tripId, String reason) {
        return new RecordOutcome(tripId, Status.REJECTED, reason);
    }

    public static RecordOutcome failed(String tripId, String reason) {
        return new RecordOutcome(tripId, Status.FAILED, reason);
    }

    public boolean isProcessed() {
        return status == Status.PROCESSED;
    }
}
