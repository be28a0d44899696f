package com.payment.facilitator.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One audited status change of a payment record.
 */
@Value
@Builder
@Jacksonized
public class PaymentTransition {

    String paymentId;
    PaymentStatus fromStatus;
    PaymentStatus toStatus;
    String transactionRef;
    FailureReason failureReason;
    String message;
    Instant occurredAt;
}
