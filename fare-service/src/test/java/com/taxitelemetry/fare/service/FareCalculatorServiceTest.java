package com.taxitelemetry.fare.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FareCalculatorService.
 *
 * Formula: fare = 50.00 + distKm * 18.50 (+ 100.00 when the zone contains "Airport")
 *          total = fare + extra + tip + tolls
 */
class FareCalculatorServiceTest {

    private FareCalculatorService calculator;

    @BeforeEach
    void setUp() {
        calculator = new FareCalculatorService();
    }

    @Test
    @DisplayName("10 km from \"Airport Terminal\" = 50 + 185 + 100 = 335.00")
    void calculate_airportTrip() {
        BigDecimal fare = calculator.calculate(new BigDecimal("10"), "Airport Terminal");
        assertThat(fare).isEqualByComparingTo("335.00");
    }

    @Test
    @DisplayName("0 km in \"Downtown\" = base fare only = 50.00")
    void calculate_zeroDistance() {
        BigDecimal fare = calculator.calculate(BigDecimal.ZERO, "Downtown");
        assertThat(fare).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("8.2 km in \"Downtown Plaza\" = 50 + 151.70 = 201.70")
    void calculate_cityTrip() {
        // 8.2 * 18.5 = 151.70
        assertThat(calculator.calculate(new BigDecimal("8.2"), "Downtown Plaza")).isEqualByComparingTo("201.70");
    }

    @Test
    @DisplayName("Airport surcharge needs \"Airport\" with that capitalisation")
    void calculate_airportMatchIsCaseSensitive() {
        assertThat(calculator.calculate(BigDecimal.ONE, "airport road")).isEqualByComparingTo("68.50");
        assertThat(calculator.calculate(BigDecimal.ONE, "Kempegowda International Airport Terminal"))
                .isEqualByComparingTo("168.50");
    }

    @Test
    @DisplayName("Null zone and null distance fall back to the base fare")
    void calculate_nulls() {
        assertThat(calculator.calculate(null, null)).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("Non-numeric raw distance is treated as 0 km")
    void calculateFromRaw_nonNumeric() {
        assertThat(calculator.calculateFromRaw("abc", "Downtown")).isEqualByComparingTo("50.00");
        assertThat(calculator.calculateFromRaw("10", "Airport Terminal")).isEqualByComparingTo("335.00");
    }

    @Test
    @DisplayName("Result is always rounded to 2 decimal places, half-even")
    void calculate_roundsHalfEven() {
        // 50 + 0.01 * 18.5 = 50.185 → 50.18
        BigDecimal fare = calculator.calculate(new BigDecimal("0.01"), "Downtown");
        assertThat(fare.scale()).isEqualTo(2);
        assertThat(fare).isEqualByComparingTo("50.18");
    }

    @Test
    @DisplayName("total = fare + extra + tip + tolls, rounded to 2 places")
    void total_isAdditive() {
        BigDecimal total = calculator.total(new BigDecimal("201.70"), new BigDecimal("15.5"),
                new BigDecimal("20"), new BigDecimal("0.0"));
        assertThat(total).isEqualByComparingTo("237.20");
        assertThat(total.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Missing charges count as zero in the total")
    void total_nullCharges() {
        assertThat(calculator.total(new BigDecimal("50.00"), null, null, null)).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("Longer trips cost more than shorter trips in the same zone")
    void calculate_longerTripCostsMore() {
        BigDecimal shortTrip = calculator.calculate(new BigDecimal("2"), "Downtown");
        BigDecimal longTrip = calculator.calculate(new BigDecimal("20"), "Downtown");
        assertThat(longTrip).isGreaterThan(shortTrip);
    }
}
