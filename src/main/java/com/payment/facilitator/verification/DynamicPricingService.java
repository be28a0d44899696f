package com.payment.facilitator.verification;

import com.payment.facilitator.domain.PaymentRequirement;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Quotes the current price of a DYNAMIC requirement, in the asset's smallest unit.
 * Must be side-effect free: it is called during verification.
 */
public interface DynamicPricingService {

    BigInteger quote(PaymentRequirement requirement, Instant at);
}
