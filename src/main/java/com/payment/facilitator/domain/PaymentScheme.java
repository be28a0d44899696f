package com.payment.facilitator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the authorized amount relates to {@code maxAmountRequired}.
 */
public enum PaymentScheme {
    /** Amount must equal maxAmountRequired. */
    EXACT,
    /** Amount must not exceed maxAmountRequired. */
    UPTO,
    /** Amount must equal the price quoted by the pricing collaborator at verification time. */
    DYNAMIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PaymentScheme fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return PaymentScheme.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
