package com.taxitelemetry.fare.service;

import com.taxitelemetry.shared.util.NumericParsing;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.taxitelemetry.shared.model.TripFields.NUMERIC_FOR_PERSISTENCE;
import static com.taxitelemetry.shared.model.TripFields.PICKUP_DATETIME;
import static com.taxitelemetry.shared.model.TripFields.REQUIRED_FOR_PERSISTENCE;
import static com.taxitelemetry.shared.model.TripFields.TRIP_ID;

/**
 * Gate before persistence. A field is missing when it is absent or null; trip_id and
 * pickup_datetime also count as missing when blank, since they key and order the row.
 * Other blank strings pass through (a blank numeric field fails the numeric check).
 * All missing fields are reported together; numeric problems are reported for the
 * first offending field only.
 */
@Component
public class TripValidator {

    private static final Set<String> BLANK_IS_MISSING = Set.of(TRIP_ID, PICKUP_DATETIME);

    public ValidationResult validate(Map<String, Object> trip) {
        List<String> missing = REQUIRED_FOR_PERSISTENCE.stream()
                .filter(field -> isMissing(field, trip.get(field)))
                .toList();
        if (!missing.isEmpty()) {
            return ValidationResult.invalid("Missing required fields: " + missing);
        }

        for (String field : NUMERIC_FOR_PERSISTENCE) {
            Object value = trip.get(field);
            if (!NumericParsing.isNumeric(value)) {
                return ValidationResult.invalid("Invalid numeric value for " + field + ": " + value);
            }
        }
        return ValidationResult.ok();
    }

    private static boolean isMissing(String field, Object value) {
        if (value == null) {
            return true;
        }
        return BLANK_IS_MISSING.contains(field) && value instanceof String text && text.isBlank();
    }
}
