package com.taxitelemetry.fare.service;

import com.taxitelemetry.shared.model.TripRecord;
import com.taxitelemetry.shared.util.NumericParsing;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Set;

import static com.taxitelemetry.shared.model.TripFields.*;

/**
 * Builds a typed TripRecord from a validated queue message. Upstream fare and total
 * are dropped, they are always recomputed. Absent optional charges stay null so
 * defaulting can tell them apart; present but unparsable ones become 0. Charges are
 * rounded half-even to cents here, so the stored parts add up to the stored total.
 */
@Component
public class TripRecordReader {

    private static final BigDecimal ZERO_AMOUNT = new BigDecimal("0.0");

    private static final Set<String> TYPED_FIELDS = Set.of(
            TRIP_ID, TAXI_ID, PICKUP_DATETIME,
            LATITUDE, LONGITUDE, PICKUP_LAT, PICKUP_LONG, DROP_LAT, DROP_LONG, DISTANCE_KM,
            ZONE_NAME, PASSENGER_COUNT, FARE_AMOUNT, EXTRA_CHARGES,
            TIP_AMOUNT, TOLLS_AMOUNT, TOTAL_AMOUNT, PAYMENT_TYPE);

    public TripRecord read(Map<String, Object> trip) {
        TripRecord record = TripRecord.builder()
                .tripId(text(trip.get(TRIP_ID)))
                .taxiId(text(trip.get(TAXI_ID)))
                .pickupDatetime(text(trip.get(PICKUP_DATETIME)))
                .latitude(optionalDouble(trip, LATITUDE))
                .longitude(optionalDouble(trip, LONGITUDE))
                .pickupLat(NumericParsing.toDouble(trip.get(PICKUP_LAT), 0))
                .pickupLong(NumericParsing.toDouble(trip.get(PICKUP_LONG), 0))
                .dropLat(NumericParsing.toDouble(trip.get(DROP_LAT), 0))
                .dropLong(NumericParsing.toDouble(trip.get(DROP_LONG), 0))
                .distanceKm(NumericParsing.toDouble(trip.get(DISTANCE_KM), 0))
                .zoneName(text(trip.get(ZONE_NAME)))
                .passengerCount(trip.get(PASSENGER_COUNT) == null ? null : NumericParsing.toInteger(trip.get(PASSENGER_COUNT), 0))
                .extraCharges(optionalAmount(trip, EXTRA_CHARGES))
                .tipAmount(optionalAmount(trip, TIP_AMOUNT))
                .tollsAmount(optionalAmount(trip, TOLLS_AMOUNT))
                .paymentType(text(trip.get(PAYMENT_TYPE)))
                .build();

        trip.forEach((field, value) -> {
            if (!TYPED_FIELDS.contains(field)) {
                record.putAttribute(field, value);
            }
        });
        return record;
    }

    private static Double optionalDouble(Map<String, Object> trip, String field) {
        Object value = trip.get(field);
        return value == null ? null : NumericParsing.toDouble(value, 0);
    }

    private static BigDecimal optionalAmount(Map<String, Object> trip, String field) {
        Object value = trip.get(field);
        return value == null ? null : NumericParsing.toDecimal(value, ZERO_AMOUNT).setScale(2, RoundingMode.HALF_EVEN);
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
