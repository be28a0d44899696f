package com.payment.facilitator.messaging;

import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Event published when a payment record reaches a terminal state, for webhook delivery
 * and reconciliation consumers. Keyed by payment id so events for one payment stay ordered.
 */
@Value
@Builder
@Jacksonized
public class SettlementNotification {

    String eventId;
    /** SETTLEMENT_COMPLETED, SETTLEMENT_FAILED or SETTLEMENT_TIMEOUT */
    String eventType;
    String paymentId;
    PaymentStatus status;
    String network;
    String payer;
    String payee;
    String asset;
    /** Smallest-unit amount as a decimal string. */
    String amount;
    String resource;
    String transactionRef;
    Integer confirmations;
    FailureReason failureReason;
    String message;
    Instant createdAt;
    Instant completedAt;
}
