package com.taxitelemetry.enrichment.exception;

public class TripDecodeException extends RuntimeException {

    private final String code;

    public TripDecodeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
