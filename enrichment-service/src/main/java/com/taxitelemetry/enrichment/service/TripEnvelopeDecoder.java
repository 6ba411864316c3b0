package com.taxitelemetry.enrichment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taxitelemetry.enrichment.exception.TripDecodeException;
import com.taxitelemetry.shared.events.TripStreamEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Unwraps a stream message: envelope JSON, then base64 data, then the trip JSON object.
 * The trip is returned as a tree so attributes this stage does not know about survive.
 */
@Component
@RequiredArgsConstructor
public class TripEnvelopeDecoder {

    private final ObjectMapper objectMapper;

    public ObjectNode decode(String message) {
        if (message == null) {
            throw new TripDecodeException("EMPTY_MESSAGE", "Message has no value", null);
        }

        TripStreamEnvelope envelope;
        try {
            envelope = objectMapper.readValue(message, TripStreamEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new TripDecodeException("MALFORMED_ENVELOPE", "Envelope is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (envelope == null) {
            throw new TripDecodeException("EMPTY_MESSAGE", "Envelope is null", null);
        }

        byte[] payload;
        try {
            payload = envelope.decodeData();
        } catch (IllegalArgumentException e) {
            throw new TripDecodeException("MALFORMED_DATA", "Envelope data is not base64: " + e.getMessage(), e);
        }

        JsonNode trip;
        try {
            trip = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new TripDecodeException("MALFORMED_TRIP", "Trip payload is not valid JSON: " + e.getMessage(), e);
        }
        if (trip == null || !trip.isObject()) {
            throw new TripDecodeException("MALFORMED_TRIP", "Trip payload is not a JSON object", null);
        }
        return (ObjectNode) trip;
    }
}
