package com.payment.facilitator.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Ledger view of one authorization's settlement. The requirement is held by value;
 * {@code version} is the optimistic-lock version the record was read at.
 */
@Value
@Builder(toBuilder = true)
public class PaymentRecord {

    String id;
    PaymentStatus status;
    PaymentRequirement requirement;
    PaymentAuthorization authorization;
    String transactionRef;
    /** Signed transaction bytes, kept so recovery re-broadcasts exactly what was prepared. */
    String submissionPayload;
    int confirmations;
    int attempts;
    FailureReason failureReason;
    String failureMessage;
    Instant deadline;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    public String getNetwork() {
        return authorization.getNetwork();
    }

    public String getPayer() {
        return authorization.getPayer();
    }

    /** Failed without reaching the chain and gave its nonce back; may be reopened by a new settle. */
    public boolean isNonceReleased() {
        return (status == PaymentStatus.SUBMISSION_FAILED || status == PaymentStatus.EXPIRED)
                && failureReason != null && failureReason.releasesNonce();
    }

    public boolean isPastDeadline(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
