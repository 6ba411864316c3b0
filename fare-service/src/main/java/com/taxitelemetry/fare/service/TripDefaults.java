package com.taxitelemetry.fare.service;

import com.taxitelemetry.shared.model.TripRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static com.taxitelemetry.shared.model.TripFields.DEFAULT_PAYMENT_TYPE;

/**
 * Fills optional billing fields left empty upstream. Values already present are never
 * touched, so applying the defaults twice changes nothing.
 */
@Component
public class TripDefaults {

    private static final BigDecimal ZERO_AMOUNT = new BigDecimal("0.0");

    public TripRecord apply(TripRecord record) {
        if (record.getPassengerCount() == null) {
            record.setPassengerCount(0);
        }
        if (record.getExtraCharges() == null) {
            record.setExtraCharges(ZERO_AMOUNT);
        }
        if (record.getTipAmount() == null) {
            record.setTipAmount(ZERO_AMOUNT);
        }
        if (record.getTollsAmount() == null) {
            record.setTollsAmount(ZERO_AMOUNT);
        }
        if (record.getPaymentType() == null || record.getPaymentType().isBlank()) {
            record.setPaymentType(DEFAULT_PAYMENT_TYPE);
        }
        return record;
    }
}
