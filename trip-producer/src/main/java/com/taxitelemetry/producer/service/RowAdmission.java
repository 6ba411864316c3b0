package com.taxitelemetry.producer.service;

import com.taxitelemetry.shared.model.TripRecord;

/**
 * A source row either becomes a TripRecord or is skipped with a reason.
 */
public record RowAdmission(TripRecord record, String skipReason) {

    public static RowAdmission admit(TripRecord record) {
        return new RowAdmission(record, null);
    }

    public static RowAdmission skip(String reason) {
        return new RowAdmission(null, reason);
    }

    public boolean admitted() {
        return record != null;
    }
}
