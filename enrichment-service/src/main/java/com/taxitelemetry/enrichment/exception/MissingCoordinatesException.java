package com.taxitelemetry.enrichment.exception;

public class MissingCoordinatesException extends RuntimeException {

    private final String tripId;

    public MissingCoordinatesException(String tripId, String message) {
        super(message);
        this.tripId = tripId;
    }

    public String getTripId() {
        return tripId;
    }
}
