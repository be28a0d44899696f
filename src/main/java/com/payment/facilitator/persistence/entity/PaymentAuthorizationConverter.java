package com.payment.facilitator.persistence.entity;

import com.payment.facilitator.domain.PaymentAuthorization;
import jakarta.persistence.Converter;

@Converter
public class PaymentAuthorizationConverter extends JsonAttributeConverter<PaymentAuthorization> {

    public PaymentAuthorizationConverter() {
        super(PaymentAuthorization.class);
    }
}
