package com.payment.facilitator.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Current state of a settlement as reported to callers of {@code settle}. Repeated calls
 * for the same authorization return the same record view rather than re-submitting.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SettlementResult {

    String paymentId;
    PaymentStatus status;
    String network;
    String payer;
    String transactionRef;
    Integer confirmations;
    Integer requiredConfirmations;
    Integer attempts;
    FailureReason failureReason;
    String message;
    /** For DUPLICATE_AUTHORIZATION: status of the payment that owns the reservation. */
    PaymentStatus originalStatus;
    Instant updatedAt;

    public boolean isSuccess() {
        return status == PaymentStatus.SETTLED;
    }

    public boolean isDuplicate() {
        return failureReason == FailureReason.DUPLICATE_AUTHORIZATION;
    }
}
