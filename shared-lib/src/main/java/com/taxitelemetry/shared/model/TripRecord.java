package com.taxitelemetry.shared.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical per-trip record. Columns the pipeline does not interpret (for example
 * {@code dropoff_datetime}) travel in {@link #getAttributes()} and are written back
 * out as top-level JSON properties. Null fields are left out of the JSON.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TripRecord {

    private String tripId;
    private String taxiId;
    private String pickupDatetime;

    private Double latitude;
    private Double longitude;
    private Double pickupLat;
    private Double pickupLong;
    private Double dropLat;
    private Double dropLong;
    private Double distanceKm;

    private String zoneName;

    private Integer passengerCount;
    private BigDecimal fareAmount;
    private BigDecimal extraCharges;
    private BigDecimal tipAmount;
    private BigDecimal tollsAmount;
    private BigDecimal totalAmount;
    private String paymentType;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void putAttribute(String name, Object value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(name, value);
    }
}
