package com.payment.facilitator.api;

import com.payment.facilitator.domain.PaymentTransition;
import com.payment.facilitator.domain.SettlementResult;
import lombok.Value;

import java.util.List;

/**
 * Read-only view of one payment and its audited transitions.
 */
@Value
public class PaymentDetailsDto {

    SettlementResult payment;
    List<PaymentTransition> history;
}
