package com.payment.facilitator.verification;

import com.payment.facilitator.domain.PaymentRequirement;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Default pricing: a DYNAMIC requirement costs its declared maximum.
 */
public class StaticPricingService implements DynamicPricingService {

    @Override
    public BigInteger quote(PaymentRequirement requirement, Instant at) {
        return requirement.getMaxAmountRequired();
    }
}
