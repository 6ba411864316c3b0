package com.taxitelemetry.fare.entity;

import com.taxitelemetry.shared.model.TripRecord;
import com.taxitelemetry.shared.util.NumericParsing;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One finalized trip, keyed by trip_id. Saving a trip_id that already exists
 * overwrites the row. The physical table name comes from {@code pipeline.fare.table-name}.
 */
@Entity
@Table(name = TripRecordEntity.DEFAULT_TABLE,
        indexes = {
                @Index(name = "idx_trip_record_taxi", columnList = "taxi_id"),
                @Index(name = "idx_trip_record_zone", columnList = "zone_name")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "tripId")
public class TripRecordEntity {

    public static final String DEFAULT_TABLE = "trip_records";

    @Id
    @Column(name = "trip_id", nullable = false)
    private String tripId;

    @Column(name = "taxi_id", nullable = false)
    private String taxiId;

    @Column(name = "pickup_datetime", nullable = false)
    private String pickupDatetime;

    @Column(name = "pickup_lat", columnDefinition = "NUMERIC")
    private BigDecimal pickupLat;

    @Column(name = "pickup_long", columnDefinition = "NUMERIC")
    private BigDecimal pickupLong;

    @Column(name = "drop_lat", columnDefinition = "NUMERIC")
    private BigDecimal dropLat;

    @Column(name = "drop_long", columnDefinition = "NUMERIC")
    private BigDecimal dropLong;

    @Column(name = "distance_km", columnDefinition = "NUMERIC")
    private BigDecimal distanceKm;

    @Column(name = "zone_name")
    private String zoneName;

    @Column(name = "fare_amount", precision = 10, scale = 2)
    private BigDecimal fareAmount;

    @Column(name = "passenger_count")
    private Integer passengerCount;

    @Column(name = "extra_charges", precision = 10, scale = 2)
    private BigDecimal extraCharges;

    @Column(name = "tip_amount", precision = 10, scale = 2)
    private BigDecimal tipAmount;

    @Column(name = "tolls_amount", precision = 10, scale = 2)
    private BigDecimal tollsAmount;

    @Column(name = "total_amount", precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "payment_type", length = 32)
    private String paymentType;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public static TripRecordEntity fromRecord(TripRecord record) {
        return TripRecordEntity.builder()
                .tripId(record.getTripId())
                .taxiId(emptyIfNull(record.getTaxiId()))
                .pickupDatetime(emptyIfNull(record.getPickupDatetime()))
                .pickupLat(NumericParsing.exact(record.getPickupLat()))
                .pickupLong(NumericParsing.exact(record.getPickupLong()))
                .dropLat(NumericParsing.exact(record.getDropLat()))
                .dropLong(NumericParsing.exact(record.getDropLong()))
                .distanceKm(NumericParsing.exact(record.getDistanceKm()))
                .zoneName(emptyIfNull(record.getZoneName()))
                .fareAmount(record.getFareAmount())
                .passengerCount(record.getPassengerCount())
                .extraCharges(record.getExtraCharges())
                .tipAmount(record.getTipAmount())
                .tollsAmount(record.getTollsAmount())
                .totalAmount(record.getTotalAmount())
                .paymentType(record.getPaymentType())
                .build();
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
