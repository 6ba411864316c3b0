package com.taxitelemetry.producer.service;

import com.taxitelemetry.shared.model.TripRecord;
import com.taxitelemetry.shared.util.NumericParsing;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

import static com.taxitelemetry.shared.model.TripFields.*;

/**
 * Turns a raw CSV row into a typed TripRecord.
 *
 * Admission: rows with a blank trip_id or pickup_datetime are skipped.
 * Coercion:
 *   coordinates and distance_km  → double, 0 when absent or unparsable
 *   passenger_count              → int, 0 when absent or unparsable
 *   money columns                → decimal, 0.0 when absent or unparsable
 *   extra_charges                → falls back to the legacy "extra" column
 *   latitude / longitude         → mirror pickup_lat / pickup_long when the columns are absent
 *   zone_name                    → stripped of surrounding quote characters
 * Every other column is carried through unchanged.
 */
@Component
public class TripRowNormalizer {

    private static final BigDecimal ZERO_AMOUNT = new BigDecimal("0.0");

    private static final Set<String> TYPED_COLUMNS = Set.of(
            TRIP_ID, TAXI_ID, PICKUP_DATETIME,
            LATITUDE, LONGITUDE, PICKUP_LAT, PICKUP_LONG, DROP_LAT, DROP_LONG, DISTANCE_KM,
            ZONE_NAME, PASSENGER_COUNT, FARE_AMOUNT, EXTRA_CHARGES, LEGACY_EXTRA,
            TIP_AMOUNT, TOLLS_AMOUNT, TOTAL_AMOUNT, PAYMENT_TYPE);

    public RowAdmission normalize(Map<String, String> row) {
        String tripId = row.get(TRIP_ID);
        if (isBlank(tripId)) {
            return RowAdmission.skip("Skipping row: missing trip_id");
        }
        tripId = tripId.trim();
        if (isBlank(row.get(PICKUP_DATETIME))) {
            return RowAdmission.skip("Skipping trip_id " + tripId + ": missing pickup_datetime");
        }

        Double pickupLat = NumericParsing.toDouble(row.get(PICKUP_LAT), 0);
        Double pickupLong = NumericParsing.toDouble(row.get(PICKUP_LONG), 0);

        TripRecord record = TripRecord.builder()
                .tripId(tripId)
                .taxiId(row.get(TAXI_ID))
                .pickupDatetime(row.get(PICKUP_DATETIME))
                .latitude(row.containsKey(LATITUDE) ? NumericParsing.toDouble(row.get(LATITUDE), 0) : pickupLat)
                .longitude(row.containsKey(LONGITUDE) ? NumericParsing.toDouble(row.get(LONGITUDE), 0) : pickupLong)
                .pickupLat(pickupLat)
                .pickupLong(pickupLong)
                .dropLat(NumericParsing.toDouble(row.get(DROP_LAT), 0))
                .dropLong(NumericParsing.toDouble(row.get(DROP_LONG), 0))
                .distanceKm(NumericParsing.toDouble(row.get(DISTANCE_KM), 0))
                .zoneName(stripQuotes(row.get(ZONE_NAME)))
                .passengerCount(NumericParsing.toInteger(row.get(PASSENGER_COUNT), 0))
                .fareAmount(amount(row.get(FARE_AMOUNT)))
                .extraCharges(amount(row.containsKey(EXTRA_CHARGES) ? row.get(EXTRA_CHARGES) : row.get(LEGACY_EXTRA)))
                .tipAmount(amount(row.get(TIP_AMOUNT)))
                .tollsAmount(amount(row.get(TOLLS_AMOUNT)))
                .totalAmount(amount(row.get(TOTAL_AMOUNT)))
                .paymentType(isBlank(row.get(PAYMENT_TYPE)) ? null : row.get(PAYMENT_TYPE))
                .build();

        row.forEach((column, value) -> {
            if (!TYPED_COLUMNS.contains(column)) {
                record.putAttribute(column, value);
            }
        });
        return RowAdmission.admit(record);
    }

    private static BigDecimal amount(String raw) {
        return NumericParsing.toDecimal(raw, ZERO_AMOUNT);
    }

    static String stripQuotes(String raw) {
        if (raw == null) {
            return "";
        }
        int start = 0;
        int end = raw.length();
        while (start < end && raw.charAt(start) == '"') start++;
        while (end > start && raw.charAt(end - 1) == '"') end--;
        return raw.substring(start, end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
