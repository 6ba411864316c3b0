package com.taxitelemetry.fare.service;

import com.taxitelemetry.shared.util.NumericParsing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fare calculation: flat base + per-km rate, plus a surcharge for airport zones.
 *
 * Formula:
 *   fare  = BASE_FARE + distanceKm * PER_KM_RATE  (+ AIRPORT_SURCHARGE when zone_name contains "Airport")
 *   total = fare + extraCharges + tipAmount + tollsAmount
 *
 * Both are rounded half-even to 2 places. Missing or non-numeric distance counts as 0 km;
 * missing charges count as 0.
 */
@Slf4j
@Service
public class FareCalculatorService {

    private static final BigDecimal BASE_FARE         = new BigDecimal("50.00");
    private static final BigDecimal PER_KM_RATE       = new BigDecimal("18.50");
    private static final BigDecimal AIRPORT_SURCHARGE = new BigDecimal("100.00");
    private static final String AIRPORT_MARKER        = "Airport";

    public BigDecimal calculate(BigDecimal distanceKm, String zoneName) {
        BigDecimal distance = distanceKm != null ? distanceKm : BigDecimal.ZERO;

        BigDecimal fare = BASE_FARE.add(distance.multiply(PER_KM_RATE));
        if (zoneName != null && zoneName.contains(AIRPORT_MARKER)) {
            fare = fare.add(AIRPORT_SURCHARGE);
        }
        fare = fare.setScale(2, RoundingMode.HALF_EVEN);

        log.debug("Fare calc: dist={}km zone={} -> {}", distance, zoneName, fare);
        return fare;
    }

    public BigDecimal calculateFromRaw(Object rawDistanceKm, String zoneName) {
        return calculate(NumericParsing.toDecimal(rawDistanceKm, BigDecimal.ZERO), zoneName);
    }

    public BigDecimal total(BigDecimal fare, BigDecimal extraCharges, BigDecimal tipAmount, BigDecimal tollsAmount) {
        return orZero(fare)
                .add(orZero(extraCharges))
                .add(orZero(tipAmount))
                .add(orZero(tollsAmount))
                .setScale(2, RoundingMode.HALF_EVEN);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
