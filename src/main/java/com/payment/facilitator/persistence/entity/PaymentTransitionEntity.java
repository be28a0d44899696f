package com.payment.facilitator.persistence.entity;

import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail of payment record status changes.
 */
@Entity
@Table(name = "payment_transitions", indexes = {
    @Index(name = "idx_transition_payment_id", columnList = "payment_id"),
    @Index(name = "idx_transition_occurred_at", columnList = "occurred_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransitionEntity {

    @Id
    @Column(name = "transition_id", nullable = false, length = 36)
    private String transitionId;

    @Column(name = "payment_id", nullable = false, length = 64)
    private String paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 32)
    private PaymentStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 32)
    private PaymentStatus toStatus;

    @Column(name = "transaction_ref", length = 128)
    private String transactionRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 64)
    private FailureReason failureReason;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
