package com.payment.facilitator.persistence.entity;

import com.payment.facilitator.domain.PaymentRequirement;
import jakarta.persistence.Converter;

@Converter
public class PaymentRequirementConverter extends JsonAttributeConverter<PaymentRequirement> {

    public PaymentRequirementConverter() {
        super(PaymentRequirement.class);
    }
}
