package com.taxitelemetry.shared.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class TripRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Serializes with snake_case wire names and flattens pass-through attributes")
    void serialize_snakeCaseAndAttributes() throws Exception {
        TripRecord record = TripRecord.builder()
                .tripId("T1")
                .pickupLong(77.6)
                .dropLat(12.95)
                .fareAmount(new BigDecimal("201.70"))
                .build();
        record.putAttribute(TripFields.DROPOFF_DATETIME, "2024-01-01T08:30:00");

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(record));

        assertThat(json.get(TripFields.TRIP_ID).asText()).isEqualTo("T1");
        assertThat(json.get(TripFields.PICKUP_LONG).asDouble()).isEqualTo(77.6);
        assertThat(json.get(TripFields.DROP_LAT).asDouble()).isEqualTo(12.95);
        assertThat(json.get(TripFields.FARE_AMOUNT).decimalValue()).isEqualByComparingTo("201.7");
        assertThat(json.get(TripFields.DROPOFF_DATETIME).asText()).isEqualTo("2024-01-01T08:30:00");
        assertThat(json.has("attributes")).isFalse();
    }

    @Test
    @DisplayName("Unknown JSON properties land in attributes")
    void deserialize_unknownPropertiesKept() throws Exception {
        TripRecord record = objectMapper.readValue(
                "{\"trip_id\":\"T9\",\"zone_name\":\"Airport\",\"vendor\":\"acme\"}", TripRecord.class);

        assertThat(record.getTripId()).isEqualTo("T9");
        assertThat(record.getZoneName()).isEqualTo("Airport");
        assertThat(record.getAttributes()).containsEntry("vendor", "acme");
    }
}
